package org.janelia.registration.pipeline;

import ij.process.ShortProcessor;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.registration.checkpoint.CheckpointCodec;
import org.janelia.registration.checkpoint.CheckpointKey;
import org.janelia.registration.checkpoint.CheckpointStore;
import org.janelia.registration.checkpoint.FileCheckpointStore;
import org.janelia.registration.checkpoint.JsonCheckpointCodec;
import org.janelia.registration.checkpoint.Stage;
import org.janelia.registration.checkpoint.TiffTileCodec;
import org.janelia.registration.executor.StageExecutor;
import org.janelia.registration.executor.StageReport;
import org.janelia.registration.grid.GridPlanner;
import org.janelia.registration.grid.ImageShape;
import org.janelia.registration.grid.InvalidConfigurationException;
import org.janelia.registration.grid.TileArea;
import org.janelia.registration.grid.TileCoordinate;
import org.janelia.registration.grid.TileGrid;
import org.janelia.registration.grid.TilingParameters;
import org.janelia.registration.image.ImageSink;
import org.janelia.registration.image.ImageSource;
import org.janelia.registration.image.N5ImageStore;
import org.janelia.registration.image.TileImages;
import org.janelia.registration.mapping.AffineEstimator;
import org.janelia.registration.mapping.AffineMapping;
import org.janelia.registration.mapping.BilinearAffineApplier;
import org.janelia.registration.mapping.DeformableApplier;
import org.janelia.registration.mapping.DeformableEstimator;
import org.janelia.registration.mapping.DeformableMapping;
import org.janelia.registration.mapping.DisplacementFieldApplier;
import org.janelia.registration.mapping.Estimators;
import org.janelia.registration.mapping.InsufficientFeaturesException;
import org.janelia.registration.mapping.TransformApplier;
import org.janelia.registration.stitch.OverlapRemover;
import org.janelia.registration.stitch.StitchIncompleteException;
import org.janelia.registration.stitch.Stitcher;
import org.janelia.registration.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;

/**
 * Runs the registration stages for one reference and moving image pair in dependency order.
 *
 * Each stage derives its checkpoint keys from the tile grid, skips keys that already have
 * checkpoints, and waits for all of its units before returning.  Unit failures are reported
 * but do not stop later stages, whose units for the affected coordinates then fail on their
 * missing inputs.
 *
 * @author Eric Trautman
 */
public class PipelineController {

    public static final String GRID_FILE_NAME = "grid.json";

    public static final CheckpointCodec<ShortProcessor> TILE_CODEC = new TiffTileCodec();
    public static final CheckpointCodec<AffineMapping> AFFINE_CODEC =
            new JsonCheckpointCodec<>(AffineMapping.class);
    public static final CheckpointCodec<DeformableMapping> DEFORMABLE_CODEC =
            new JsonCheckpointCodec<>(DeformableMapping.class);

    private final PipelineConfiguration configuration;
    private final ImageSource imageSource;
    private final ImageSink imageSink;
    private final CheckpointStore checkpointStore;
    private final AffineEstimator affineEstimator;
    private final TransformApplier transformApplier;
    private final DeformableEstimator deformableEstimator;
    private final DeformableApplier deformableApplier;
    private final StageExecutor stageExecutor;

    private TileGrid grid;
    private ImageShape movingShape;

    public PipelineController(final PipelineConfiguration configuration,
                              final ImageSource imageSource,
                              final ImageSink imageSink,
                              final CheckpointStore checkpointStore,
                              final AffineEstimator affineEstimator,
                              final TransformApplier transformApplier,
                              final DeformableEstimator deformableEstimator,
                              final DeformableApplier deformableApplier)
            throws InvalidConfigurationException {

        configuration.validate();

        this.configuration = configuration;
        this.imageSource = imageSource;
        this.imageSink = imageSink;
        this.checkpointStore = checkpointStore;
        this.affineEstimator = affineEstimator;
        this.transformApplier = transformApplier;
        this.deformableEstimator = deformableEstimator;
        this.deformableApplier = deformableApplier;
        this.stageExecutor = new StageExecutor(checkpointStore, configuration.getMaxConcurrency());
        this.grid = null;
        this.movingShape = null;
    }

    /**
     * @return controller that uses N5 images, file system checkpoints, bilinear appliers,
     *         and the estimator classes named in the configuration.
     */
    public static PipelineController build(final PipelineConfiguration configuration)
            throws IllegalArgumentException {
        final N5ImageStore imageStore = new N5ImageStore();
        return new PipelineController(configuration,
                                      imageStore,
                                      imageStore,
                                      new FileCheckpointStore(configuration.getCheckpointLayout()),
                                      Estimators.newAffineEstimator(configuration.getAffineEstimatorClass()),
                                      new BilinearAffineApplier(),
                                      Estimators.newDeformableEstimator(configuration.getDeformableEstimatorClass()),
                                      new DisplacementFieldApplier());
    }

    public PipelineConfiguration getConfiguration() {
        return configuration;
    }

    public CheckpointStore getCheckpointStore() {
        return checkpointStore;
    }

    /**
     * Stops dispatching units.  Running units finish and keep their checkpoints.
     */
    public void cancel() {
        stageExecutor.cancel();
    }

    /**
     * Reads both image shapes, pads them to a common shape, and plans the tile grid.
     * The first planned grid is recorded in the mappings directory.
     * Later invocations re-plan the grid and verify that it still matches the recorded one.
     *
     * @throws InvalidConfigurationException
     *   if the configuration cannot produce a valid grid or differs from the recorded grid.
     *
     * @throws InsufficientFeaturesException
     *   if overlaps must be estimated and the affine estimator cannot find enough features.
     */
    public synchronized TileGrid planGrid()
            throws InvalidConfigurationException, InsufficientFeaturesException, IOException {

        if (grid != null) {
            return grid;
        }

        final ImageShape referenceShape = imageSource.getShape(configuration.getReferenceImage());
        final ImageShape moving = imageSource.getShape(configuration.getMovingImage());
        final int registrationChannel = configuration.getRegistrationChannel();
        if ((registrationChannel >= referenceShape.getChannels()) || (registrationChannel >= moving.getChannels())) {
            throw new InvalidConfigurationException(
                    "registration channel " + registrationChannel + " does not exist in reference image " +
                    referenceShape + " or moving image " + moving);
        }

        final ImageShape paddedShape = referenceShape.padTo(moving);

        final Path gridPath = Paths.get(configuration.getCheckpointLayout().getMappingsDirectory(), GRID_FILE_NAME);
        final TileGrid recordedGrid = Files.exists(gridPath) ? loadGrid(gridPath) : null;

        final TilingParameters tiling;
        if (configuration.hasOverlaps()) {
            tiling = configuration.getTilingParameters();
        } else if (recordedGrid != null) {
            final TilingParameters recordedTiling = recordedGrid.getTilingParameters();
            tiling = configuration.getTilingParameters().withOverlap(recordedTiling.getOverlapX(),
                                                                      recordedTiling.getOverlapY());
            LOG.info("planGrid: using overlaps recorded in {}", gridPath);
        } else {
            tiling = estimateOverlaps(paddedShape);
        }

        final TileGrid plannedGrid = GridPlanner.plan(paddedShape, tiling);

        if (recordedGrid == null) {
            FileUtil.saveJsonFile(gridPath, plannedGrid);
        } else if (! recordedGrid.equals(plannedGrid)) {
            throw new InvalidConfigurationException(
                    "planned grid " + plannedGrid + " with tiling " + tiling + " differs from grid " + recordedGrid +
                    " with tiling " + recordedGrid.getTilingParameters() + " recorded in " + gridPath +
                    ", use a different checkpoint directory for a different configuration");
        }

        LOG.info("planGrid: reference shape is {}, moving shape is {}, planned {} with tiling {}",
                 referenceShape, moving, plannedGrid, tiling);

        this.movingShape = moving;
        this.grid = plannedGrid;

        return grid;
    }

    /**
     * Estimates the global affine mapping from the registration channel of both images.
     *
     * @throws InsufficientFeaturesException
     *   if the images do not share enough features.
     *
     * @throws IllegalStateException
     *   if estimation fails for any other reason.
     */
    public StageReport estimateAffine()
            throws InsufficientFeaturesException, IOException, InterruptedException, IllegalStateException {

        final TileGrid tileGrid = planGrid();
        final CheckpointKey key = CheckpointKey.forStage(Stage.AFFINE_MAPPING);

        final StageReport report = stageExecutor.run("estimateAffine",
                                                     Collections.singletonList(key),
                                                     k -> estimateAffineMapping(k, tileGrid.getImageShape()));

        final Throwable failure = report.getFailures().get(key);
        if (failure instanceof InsufficientFeaturesException) {
            throw (InsufficientFeaturesException) failure;
        } else if (failure != null) {
            throw new IllegalStateException("failed to estimate affine mapping", failure);
        }

        return report;
    }

    /**
     * Extracts reference crops for the registration channel and margin-grown moving crops for every channel.
     */
    public List<StageReport> extractCrops()
            throws InsufficientFeaturesException, IOException, InterruptedException {

        final TileGrid tileGrid = planGrid();
        final List<StageReport> reports = new ArrayList<>();

        final List<CheckpointKey> referenceKeys = new ArrayList<>();
        for (final TileCoordinate coordinate : tileGrid.getCoordinates()) {
            referenceKeys.add(CheckpointKey.forTileChannel(Stage.REFERENCE_CROP,
                                                           coordinate,
                                                           configuration.getRegistrationChannel()));
        }
        reports.add(stageExecutor.run("extractReferenceCrops", referenceKeys, this::extractReferenceCrop));

        reports.add(stageExecutor.run("extractMovingCrops",
                                      buildTileChannelKeys(Stage.MOVING_CROP),
                                      this::extractMovingCrop));
        return reports;
    }

    /**
     * Applies the global affine mapping to every moving crop.
     */
    public StageReport applyAffine()
            throws InsufficientFeaturesException, IOException, InterruptedException {
        planGrid();
        return stageExecutor.run("applyAffine", buildTileChannelKeys(Stage.AFFINE_TILE), this::applyAffineToCrop);
    }

    /**
     * Estimates a deformable mapping for every tile from the registration channel.
     */
    public StageReport estimateDeformable()
            throws InsufficientFeaturesException, IOException, InterruptedException {
        final TileGrid tileGrid = planGrid();
        final List<CheckpointKey> keys = new ArrayList<>();
        for (final TileCoordinate coordinate : tileGrid.getCoordinates()) {
            keys.add(CheckpointKey.forTile(Stage.DEFORMABLE_MAPPING, coordinate));
        }
        return stageExecutor.run("estimateDeformable", keys, this::estimateDeformableMapping);
    }

    /**
     * Applies each tile's deformable mapping to every channel of its affine registered tile.
     */
    public StageReport applyDeformable()
            throws InsufficientFeaturesException, IOException, InterruptedException {
        planGrid();
        return stageExecutor.run("applyDeformable",
                                 buildTileChannelKeys(Stage.DEFORMABLE_TILE),
                                 this::applyDeformableToTile);
    }

    /**
     * Removes shared borders from the registered tiles of the specified transformation.
     */
    public StageReport trimOverlaps(final Transformation transformation)
            throws InsufficientFeaturesException, IOException, InterruptedException {
        final OverlapRemover overlapRemover = new OverlapRemover(planGrid());
        return stageExecutor.run("trimOverlaps" + transformation,
                                 buildTileChannelKeys(transformation.getTrimmedStage()),
                                 k -> trimTile(k, transformation, overlapRemover));
    }

    /**
     * Assembles the trimmed tiles of the specified transformation and writes the output image.
     *
     * @throws StitchIncompleteException
     *   if any trimmed tile is missing.
     */
    public void stitch(final Transformation transformation)
            throws StitchIncompleteException, InsufficientFeaturesException, IOException {

        final String outputImage = configuration.getOutputImage();
        if (outputImage == null) {
            throw new InvalidConfigurationException("output image must be defined for stitching");
        }

        final Stitcher stitcher = new Stitcher(planGrid());
        stitcher.stitch(checkpointStore,
                        transformation.getTrimmedStage(),
                        movingShape.getChannels(),
                        TILE_CODEC,
                        imageSink,
                        outputImage);
    }

    /**
     * Runs grid planning and every registration stage up to deformable application.
     *
     * @return reports for each stage.
     */
    public List<StageReport> runRegistration()
            throws InsufficientFeaturesException, IOException, InterruptedException {

        final Stopwatch stopwatch = Stopwatch.createStarted();
        LOG.info("runRegistration: entry, configuration is {}", configuration);

        final List<StageReport> reports = new ArrayList<>();
        planGrid();
        reports.add(estimateAffine());
        reports.addAll(extractCrops());
        reports.add(applyAffine());
        reports.add(estimateDeformable());
        reports.add(applyDeformable());

        LOG.info("runRegistration: exit, elapsed time is {}", stopwatch);

        return reports;
    }

    /**
     * Runs all registration stages, trims the tiles of the configured transformation, and stitches them.
     *
     * @return reports for each stage.
     *
     * @throws StitchIncompleteException
     *   if any unit failed, leaving trimmed tiles missing.
     */
    public List<StageReport> run()
            throws StitchIncompleteException, InsufficientFeaturesException, IOException, InterruptedException {

        final Stopwatch stopwatch = Stopwatch.createStarted();

        final List<StageReport> reports = runRegistration();
        reports.add(trimOverlaps(configuration.getTransformation()));
        stitch(configuration.getTransformation());

        LOG.info("run: exit, wrote {}, elapsed time is {}", configuration.getOutputImage(), stopwatch);

        return reports;
    }

    private List<CheckpointKey> buildTileChannelKeys(final Stage stage) {
        final List<CheckpointKey> keys = new ArrayList<>();
        for (final TileCoordinate coordinate : grid.getCoordinates()) {
            for (int channel = 0; channel < movingShape.getChannels(); channel++) {
                keys.add(CheckpointKey.forTileChannel(stage, coordinate, channel));
            }
        }
        return keys;
    }

    private TilingParameters estimateOverlaps(final ImageShape paddedShape)
            throws InsufficientFeaturesException, IOException {

        final int size = configuration.getOverlapEstimationSize();
        final TileArea sampleArea = new TileArea(0, Math.min(size, paddedShape.getHeight()),
                                                 0, Math.min(size, paddedShape.getWidth()));

        LOG.info("estimateOverlaps: estimating overlaps from area {}", sampleArea);

        final int channel = configuration.getRegistrationChannel();
        final ShortProcessor referenceSample =
                imageSource.readRegion(configuration.getReferenceImage(), sampleArea, channel);
        final ShortProcessor movingSample =
                imageSource.readRegion(configuration.getMovingImage(), sampleArea, channel);

        final OverlapEstimator overlapEstimator =
                new OverlapEstimator(affineEstimator, transformApplier, configuration.getOverlapFactor());
        return overlapEstimator.estimate(referenceSample, movingSample, configuration.getTilingParameters());
    }

    private void estimateAffineMapping(final CheckpointKey key,
                                       final ImageShape paddedShape)
            throws InsufficientFeaturesException, IOException {

        final Integer regionSize = configuration.getAffineEstimationRegionSize();
        final TileArea area;
        if (regionSize == null) {
            area = new TileArea(0, paddedShape.getHeight(), 0, paddedShape.getWidth());
        } else {
            area = new TileArea(0, Math.min(regionSize, paddedShape.getHeight()),
                                0, Math.min(regionSize, paddedShape.getWidth()));
        }

        LOG.info("estimateAffineMapping: reading area {} of registration channel", area);

        final int channel = configuration.getRegistrationChannel();
        final ShortProcessor reference = imageSource.readRegion(configuration.getReferenceImage(), area, channel);
        final ShortProcessor moving = imageSource.readRegion(configuration.getMovingImage(), area, channel);

        final AffineMapping mapping = affineEstimator.compute(reference, moving);

        LOG.info("estimateAffineMapping: estimated {}", mapping);

        checkpointStore.put(key, mapping, AFFINE_CODEC);
    }

    private void extractReferenceCrop(final CheckpointKey key)
            throws IOException {
        final TileArea area = grid.getArea(key.getCoordinate());
        final ShortProcessor crop = imageSource.readRegion(configuration.getReferenceImage(), area, key.getChannel());
        checkpointStore.put(key, crop, TILE_CODEC);
    }

    private void extractMovingCrop(final CheckpointKey key)
            throws IOException {
        final TileArea area = grid.getArea(key.getCoordinate()).grow(configuration.getCropMargin());
        final ShortProcessor crop = imageSource.readRegion(configuration.getMovingImage(), area, key.getChannel());
        checkpointStore.put(key, crop, TILE_CODEC);
    }

    private void applyAffineToCrop(final CheckpointKey key)
            throws IOException {

        final AffineMapping mapping = checkpointStore.get(CheckpointKey.forStage(Stage.AFFINE_MAPPING), AFFINE_CODEC);
        final ShortProcessor crop = checkpointStore.get(key.withStage(Stage.MOVING_CROP, key.getChannel()),
                                                        TILE_CODEC);

        final int margin = configuration.getCropMargin();
        final TileArea area = grid.getArea(key.getCoordinate());
        final int width = crop.getWidth() - (2 * margin);
        final int height = crop.getHeight() - (2 * margin);
        if ((width < 1) || (height < 1)) {
            throw new IllegalStateException("moving crop for " + key + " is " + TileImages.shapeString(crop) +
                                            " which is too small for a margin of " + margin);
        }

        final AffineMapping localMapping = mapping.inLocalFrame(area.getColStart() - margin,
                                                                area.getRowStart() - margin);
        final ShortProcessor transformed = transformApplier.apply(localMapping, crop);
        final ShortProcessor tile = TileImages.crop(transformed, margin, margin, width, height);

        checkpointStore.put(key, tile, TILE_CODEC);
    }

    private void estimateDeformableMapping(final CheckpointKey key)
            throws IOException {

        final int channel = configuration.getRegistrationChannel();
        final ShortProcessor reference = checkpointStore.get(key.withStage(Stage.REFERENCE_CROP, channel),
                                                             TILE_CODEC);
        final ShortProcessor moving = checkpointStore.get(key.withStage(Stage.AFFINE_TILE, channel),
                                                          TILE_CODEC);

        final DeformableMapping mapping;
        if (! TileImages.hasSameShape(reference, moving)) {
            mapping = DeformableMapping.shapeMismatch("reference tile is " + TileImages.shapeString(reference) +
                                                      " but affine tile is " + TileImages.shapeString(moving));
            LOG.warn("estimateDeformableMapping: {} for {}", mapping, key.getCoordinate());
        } else if (TileImages.isUniform(moving)) {
            mapping = DeformableMapping.degenerate("affine tile has uniform intensity");
            LOG.info("estimateDeformableMapping: {} for {}", mapping, key.getCoordinate());
        } else {
            mapping = deformableEstimator.compute(reference, moving);
        }

        checkpointStore.put(key, mapping, DEFORMABLE_CODEC);
    }

    private void applyDeformableToTile(final CheckpointKey key)
            throws IOException {

        final DeformableMapping mapping =
                checkpointStore.get(key.withStage(Stage.DEFORMABLE_MAPPING, key.getChannel()), DEFORMABLE_CODEC);
        final ShortProcessor affineTile = checkpointStore.get(key.withStage(Stage.AFFINE_TILE, key.getChannel()),
                                                              TILE_CODEC);

        final ShortProcessor tile;
        if (mapping.isComputed() && (! TileImages.isUniform(affineTile))) {
            tile = deformableApplier.apply(mapping.getField(), affineTile);
        } else {
            tile = affineTile;
        }

        checkpointStore.put(key, tile, TILE_CODEC);
    }

    private void trimTile(final CheckpointKey key,
                          final Transformation transformation,
                          final OverlapRemover overlapRemover)
            throws IOException {
        final ShortProcessor registeredTile =
                checkpointStore.get(key.withStage(transformation.getRegisteredStage(), key.getChannel()),
                                    TILE_CODEC);
        final TileArea area = grid.getArea(key.getCoordinate());
        if ((registeredTile.getWidth() != area.getWidth()) || (registeredTile.getHeight() != area.getHeight())) {
            LOG.warn("trimTile: registered tile for {} is {} but its area is {}x{}, cropping or zero filling it",
                     key, TileImages.shapeString(registeredTile), area.getHeight(), area.getWidth());
        }
        final ShortProcessor tile = TileImages.conformTo(registeredTile, area.getWidth(), area.getHeight());
        checkpointStore.put(key, overlapRemover.trim(key.getCoordinate(), tile), TILE_CODEC);
    }

    private static TileGrid loadGrid(final Path gridPath)
            throws IOException {
        try (final Reader reader = Files.newBufferedReader(gridPath)) {
            return TileGrid.fromJson(reader);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PipelineController.class);
}
