package org.janelia.registration.checkpoint;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

import org.janelia.registration.grid.TileCoordinate;
import org.janelia.registration.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CheckpointStore} backed by one file per record in the directories of a {@link CheckpointLayout}.
 *
 * Payloads are first written to a hidden temporary file in the target directory and then
 * published with a hard link, which fails if the record already exists.
 * On file systems without hard link support, the temporary file is atomically renamed instead.
 * Interrupted writes therefore only leave temporary files behind and those are never
 * reported as existing records.
 *
 * @author Eric Trautman
 */
public class FileCheckpointStore
        implements CheckpointStore {

    private final CheckpointLayout layout;

    public FileCheckpointStore(final CheckpointLayout layout) {
        this.layout = layout;
    }

    public CheckpointLayout getLayout() {
        return layout;
    }

    /**
     * @return path of the record file for the specified key.
     */
    public Path getPath(final CheckpointKey key) {
        return layout.getStageDirectory(key.getStage()).resolve(getFileName(key));
    }

    @Override
    public boolean exists(final CheckpointKey key) {
        return Files.isRegularFile(getPath(key));
    }

    @Override
    public <T> void put(final CheckpointKey key,
                        final T payload,
                        final CheckpointCodec<T> codec)
            throws CheckpointWriteException {

        final Path path = getPath(key);
        final Path directory = path.getParent();

        Path temporaryPath = null;
        try {
            FileUtil.ensureWritableDirectory(directory.toFile());

            temporaryPath = Files.createTempFile(directory, "." + path.getFileName() + ".", ".tmp");
            try (final OutputStream outputStream = Files.newOutputStream(temporaryPath)) {
                codec.encode(payload, outputStream);
            }
            try (final FileChannel channel = FileChannel.open(temporaryPath, StandardOpenOption.WRITE)) {
                channel.force(true);
            }

            publish(key, temporaryPath, path);

        } catch (final Exception e) {
            throw new CheckpointWriteException(key, e);
        } finally {
            if (temporaryPath != null) {
                try {
                    Files.deleteIfExists(temporaryPath);
                } catch (final IOException e) {
                    LOG.warn("put: failed to remove temporary file {}", temporaryPath, e);
                }
            }
        }

        LOG.debug("put: wrote {}", path);
    }

    @Override
    public <T> T get(final CheckpointKey key,
                     final CheckpointCodec<T> codec)
            throws CheckpointNotFoundException, IOException {

        final Path path = getPath(key);
        if (! Files.isRegularFile(path)) {
            throw new CheckpointNotFoundException(key);
        }

        try (final InputStream inputStream = Files.newInputStream(path)) {
            return codec.decode(inputStream);
        } catch (final IOException e) {
            throw new IOException("failed to read checkpoint " + path, e);
        }
    }

    @Override
    public String toString() {
        return "FileCheckpointStore" + layout;
    }

    private void publish(final CheckpointKey key,
                         final Path temporaryPath,
                         final Path path)
            throws IOException {
        try {
            Files.createLink(path, temporaryPath);
        } catch (final FileAlreadyExistsException e) {
            LOG.warn("publish: record for {} was already written by another worker, keeping existing {}",
                     key, path);
        } catch (final UnsupportedOperationException | FileSystemException e) {
            LOG.debug("publish: hard link failed for {}, falling back to atomic rename", path, e);
            if (Files.exists(path)) {
                LOG.warn("publish: record for {} was already written by another worker, keeping existing {}",
                         key, path);
            } else {
                Files.move(temporaryPath, path, StandardCopyOption.ATOMIC_MOVE);
            }
        }
    }

    static String getFileName(final CheckpointKey key) {
        final StringBuilder sb = new StringBuilder();
        final TileCoordinate coordinate = key.getCoordinate();
        if (coordinate == null) {
            sb.append("global");
        } else {
            sb.append(String.format("r%04d_c%04d", coordinate.getRow(), coordinate.getColumn()));
        }
        if (key.getChannel() != null) {
            sb.append("_ch").append(key.getChannel());
        }
        sb.append('.').append(key.getStage().getFileExtension());
        return sb.toString();
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileCheckpointStore.class);
}
