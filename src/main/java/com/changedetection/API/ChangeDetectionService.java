package com.changedetection.API;

import com.changedetection.alignment.AlignmentPipeline;
import com.changedetection.alignment.AlignmentResult;
import com.changedetection.alignment.AlignmentStrategy;
import com.changedetection.alignment.AlignmentStrategyName;
import com.changedetection.alignment.FeatureAlignmentSettings;
import com.changedetection.alignment.FeatureAlignmentStrategy;
import com.changedetection.alignment.IntensityAlignmentStrategy;
import com.changedetection.alignment.IntensityParameters;
import com.changedetection.changeSignal.ChangeMask;
import com.changedetection.changeSignal.SignalType;
import com.changedetection.config.ChangeDetectionProperties;
import com.changedetection.feature.FeatureMethod;
import com.changedetection.fusion.ChangeDetector;
import com.changedetection.fusion.CleanupParameters;
import com.changedetection.fusion.DetectionMethod;
import com.changedetection.fusion.DetectionParameters;
import com.changedetection.fusion.DetectionResult;
import com.changedetection.fusion.FusionWeights;
import com.changedetection.imageOperator.Image;
import com.changedetection.imageOperator.ImageConverter;
import com.changedetection.preprocessing.ImagePreprocessor;
import com.changedetection.preprocessing.PreprocessParameters;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.bytedeco.opencv.global.opencv_imgcodecs.*;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGRA2BGR;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;

/**
 * Builds the engines from {@link ChangeDetectionProperties} and runs them on uploaded images.
 */
@Slf4j
@Service
public class ChangeDetectionService {
    private final ChangeDetectionProperties properties;
    private final AlignmentPipeline pipeline;
    private final ChangeDetector detector = new ChangeDetector();
    private final ImagePreprocessor preprocessor = new ImagePreprocessor();

    public ChangeDetectionService(ChangeDetectionProperties properties) {
        this.properties = properties;
        this.pipeline = buildPipeline(properties.getAlignment());
    }

    public Image decode(MultipartFile file) throws IOException {
        return decode(file.getBytes(), file.getOriginalFilename());
    }

    /**
     * Decodes any format OpenCV reads, keeping the stored bit depth and band count.
     */
    public Image decode(byte[] bytes, String name) {
        Mat encoded = new Mat(bytes);
        Mat decoded = imdecode(encoded, IMREAD_UNCHANGED);
        encoded.release();
        if (decoded == null || decoded.empty()) {
            throw new IllegalArgumentException("Cannot decode image '" + name + "'");
        }
        if (decoded.channels() == 4 && !isTiff(bytes)) {
            // PNG and WebP store alpha as the fourth channel, only TIFF carries a fourth spectral band
            Mat bgr = new Mat();
            cvtColor(decoded, bgr, COLOR_BGRA2BGR);
            decoded.release();
            decoded = bgr;
            log.debug("Dropped alpha channel of {}", name);
        }
        Image image = ImageConverter.fromMat(decoded);
        decoded.release();
        if (properties.getPreprocess().isEnabled()) {
            image = preprocessor.preprocess(image, properties.getPreprocess().getMethod(), new PreprocessParameters());
        }
        log.debug("Decoded {} as {}", name, image.describeShape());
        return image;
    }

    public AlignmentResult align(Image before, Image after, String strategy) {
        AlignmentStrategyName name = strategy == null || strategy.isBlank()
                ? properties.getAlignment().getDefaultStrategy() : AlignmentStrategyName.parse(strategy);
        return pipeline.align(before, after, name);
    }

    public DetectionResult detect(Image before, AlignmentResult alignment, String method, Double threshold) {
        DetectionMethod detectionMethod = method == null || method.isBlank()
                ? properties.getDetection().getMethod() : DetectionMethod.parse(method);
        DetectionParameters params = detectionParameters();
        params.setThreshold(threshold);
        return detector.detect(before, alignment.getAlignedImage(), detectionMethod, params);
    }

    public String encodeMask(ChangeMask mask) {
        Mat mat = ImageConverter.toMat(mask);
        BytePointer buffer = new BytePointer();
        try {
            if (!imencode(".png", mat, buffer)) {
                throw new IllegalStateException("PNG encoding of the change mask failed");
            }
            byte[] png = new byte[(int) buffer.limit()];
            buffer.get(png);
            return Base64.getEncoder().encodeToString(png);
        } finally {
            mat.release();
            buffer.close();
        }
    }

    private static boolean isTiff(byte[] bytes) {
        if (bytes.length < 4) return false;
        boolean little = bytes[0] == 'I' && bytes[1] == 'I' && bytes[2] == 42 && bytes[3] == 0;
        boolean big = bytes[0] == 'M' && bytes[1] == 'M' && bytes[2] == 0 && bytes[3] == 42;
        return little || big;
    }

    DetectionParameters detectionParameters() {
        ChangeDetectionProperties.Detection detection = properties.getDetection();
        ChangeDetectionProperties.Cleanup cleanup = properties.getCleanup();
        DetectionParameters params = new DetectionParameters();
        params.setThresholdMethod(detection.getThresholdMethod());
        params.setPercentile(detection.getPercentile());
        params.setPostProcess(detection.isPostProcess());
        params.setCleanup(new CleanupParameters(cleanup.getMinArea(), cleanup.isFillHoles(),
                cleanup.getClosingRadius(), cleanup.getOpeningRadius()));

        FusionWeights weights = FusionWeights.defaults();
        for (Map.Entry<String, Double> entry : detection.getWeights().entrySet()) {
            weights = weights.with(signalByShortName(entry.getKey()), entry.getValue());
        }
        params.setWeights(weights);
        return params;
    }

    private static SignalType signalByShortName(String name) {
        for (SignalType type : SignalType.values()) {
            if (type.getShortName().equalsIgnoreCase(name)) return type;
        }
        throw new IllegalArgumentException("Unknown signal '" + name + "' in fusion weights");
    }

    private static AlignmentPipeline buildPipeline(ChangeDetectionProperties.Alignment alignment) {
        List<AlignmentStrategy> chain = new ArrayList<>();
        for (FeatureMethod method : FeatureMethod.values()) {
            FeatureAlignmentSettings settings = FeatureAlignmentSettings.defaultsFor(method);
            settings.getKeypoints().setMinKeypoints(alignment.getMinKeypoints());
            chain.add(new FeatureAlignmentStrategy(method, settings, alignment.getSeed()));
        }
        IntensityParameters intensity = new IntensityParameters();
        intensity.setMaxIterations(alignment.getEccIterations());
        chain.add(new IntensityAlignmentStrategy(intensity));
        return new AlignmentPipeline(chain);
    }
}
