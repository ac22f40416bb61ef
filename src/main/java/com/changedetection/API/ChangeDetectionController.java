package com.changedetection.API;

import com.changedetection.alignment.AlignmentAttempt;
import com.changedetection.alignment.AlignmentResult;
import com.changedetection.changeSignal.ChangeSignal;
import com.changedetection.changeSignal.SignalType;
import com.changedetection.exception.ChangeDetectionException;
import com.changedetection.fusion.DetectionResult;
import com.changedetection.imageOperator.Image;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ChangeDetectionController {

    @Autowired
    private ChangeDetectionService changeDetectionService;

    @PostMapping(value = "/align", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> align(
            @RequestParam("before") MultipartFile before,
            @RequestParam("after") MultipartFile after,
            @RequestParam(value = "strategy", required = false) String strategy) {
        try {
            ResponseEntity<?> invalid = validate(before, after);
            if (invalid != null) return invalid;

            Image fixed = changeDetectionService.decode(before);
            Image moving = changeDetectionService.decode(after);
            AlignmentResult alignment = changeDetectionService.align(fixed, moving, strategy);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", alignment.isSuccess());
            response.put("alignment", describe(alignment));
            return ResponseEntity.ok().body(response);
        } catch (IllegalArgumentException | ChangeDetectionException e) {
            return error(e);
        } catch (Exception e) {
            log.error("Alignment request failed", e);
            return serverError(e);
        }
    }

    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> detect(
            @RequestParam("before") MultipartFile before,
            @RequestParam("after") MultipartFile after,
            @RequestParam(value = "strategy", required = false) String strategy,
            @RequestParam(value = "method", required = false) String method,
            @RequestParam(value = "threshold", required = false) Double threshold) {
        try {
            ResponseEntity<?> invalid = validate(before, after);
            if (invalid != null) return invalid;

            Image fixed = changeDetectionService.decode(before);
            Image moving = changeDetectionService.decode(after);
            AlignmentResult alignment = changeDetectionService.align(fixed, moving, strategy);
            DetectionResult detection = changeDetectionService.detect(fixed, alignment, method, threshold);

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("method", detection.getMethod().name().toLowerCase());
            stats.put("threshold", detection.getThreshold());
            stats.put("changedPixels", detection.getChangedPixels());
            stats.put("totalPixels", detection.getTotalPixels());
            stats.put("changePercentage", detection.getChangePercentage());
            List<String> fused = new ArrayList<>();
            for (SignalType type : detection.getFusedSignals()) fused.add(type.getShortName());
            stats.put("signalsFused", fused);
            Map<String, String> unavailable = new LinkedHashMap<>();
            detection.getUnavailableSignals().forEach((type, reason) -> unavailable.put(type.getShortName(), reason));
            stats.put("signalsUnavailable", unavailable);
            Map<String, Object> signals = new LinkedHashMap<>();
            for (ChangeSignal signal : detection.getSignals().values()) {
                Map<String, Object> entry = new LinkedHashMap<>(signal.getStatistics());
                entry.put("standaloneThreshold", signal.getStandaloneThreshold());
                entry.put("standaloneChangePercentage", signal.getStandaloneMask().getChangePercentage());
                signals.put(signal.getType().getShortName(), entry);
            }
            stats.put("signals", signals);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("alignment", describe(alignment));
            response.put("detection", stats);
            response.put("mask", changeDetectionService.encodeMask(detection.getMask()));
            return ResponseEntity.ok().body(response);
        } catch (IllegalArgumentException | ChangeDetectionException e) {
            return error(e);
        } catch (Exception e) {
            log.error("Detection request failed", e);
            return serverError(e);
        }
    }

    private static ResponseEntity<?> validate(MultipartFile before, MultipartFile after) {
        if (before == null || before.isEmpty() || after == null || after.isEmpty()) {
            Map<String, String> error = new HashMap<>();
            error.put("error", "Both 'before' and 'after' images are required.");
            return ResponseEntity.badRequest().body(error);
        }
        return null;
    }

    private static Map<String, Object> describe(AlignmentResult alignment) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", alignment.isSuccess());
        out.put("method", alignment.getMethod());
        out.put("transform", alignment.getTransform().toArray());
        out.put("keypointsFixed", alignment.getKeypointsFixed());
        out.put("keypointsMoving", alignment.getKeypointsMoving());
        out.put("matches", alignment.getMatches());
        out.put("inliers", alignment.getInliers());
        out.put("inlierRatio", alignment.getInlierRatio());
        out.put("rmsResidual", Double.isNaN(alignment.getRmsResidual()) ? null : alignment.getRmsResidual());
        List<String> attempts = new ArrayList<>();
        for (AlignmentAttempt attempt : alignment.getAttempts()) attempts.add(attempt.toString());
        out.put("attempts", attempts);
        return out;
    }

    static ResponseEntity<?> error(Exception e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    static ResponseEntity<?> serverError(Exception e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", "Error: " + e.getMessage());
        return ResponseEntity.internalServerError().body(error);
    }
}
