package com.changedetection.matchAndTransform;

import com.changedetection.exception.InsufficientMatchesException;
import com.changedetection.feature.FeatureSet;
import com.changedetection.feature.Keypoint;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.DMatch;
import org.bytedeco.opencv.opencv_core.DMatchVector;
import org.bytedeco.opencv.opencv_core.DMatchVectorVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.BFMatcher;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairs descriptors of two feature sets with a brute-force 2-NN search and Lowe's ratio test.
 */
@Slf4j
public class MatchEngine {

    public List<Correspondence> match(FeatureSet a, FeatureSet b, MatchParameters params)
            throws InsufficientMatchesException {
        if (a.getMethod() != b.getMethod()) {
            throw new IllegalArgumentException("Cannot match " + a.getMethod() + " against " + b.getMethod());
        }
        String stage = a.getMethod() + " matching";
        if (a.isEmpty() || b.isEmpty()) {
            throw new InsufficientMatchesException(stage, 0, params.getMinMatches());
        }

        Mat descA = a.toDescriptorMat();
        Mat descB = b.toDescriptorMat();
        BFMatcher matcher = new BFMatcher(a.getMethod().getNormType(), false);
        DMatchVectorVector knnMatches = new DMatchVectorVector();
        try {
            matcher.knnMatch(descA, descB, knnMatches, 2);
        } finally {
            descA.release();
            descB.release();
            matcher.close();
        }

        List<Correspondence> candidates = new ArrayList<>();
        for (long i = 0; i < knnMatches.size(); i++) {
            DMatchVector pair = knnMatches.get(i);
            if (pair.size() < 2) continue;
            DMatch best = pair.get(0);
            DMatch second = pair.get(1);
            if (best.distance() < params.getMaxRatio() * second.distance()) {
                Keypoint kpA = a.getKeypoints().get(best.queryIdx());
                Keypoint kpB = b.getKeypoints().get(best.trainIdx());
                candidates.add(new Correspondence(best.queryIdx(), best.trainIdx(),
                        kpA.getX(), kpA.getY(), kpB.getX(), kpB.getY(), best.distance()));
            }
        }

        List<Correspondence> matches = params.isUnique() ? keepUnique(candidates) : candidates;
        log.debug("{}: {} ratio-test survivors, {} kept", stage, candidates.size(), matches.size());

        if (matches.size() < params.getMinMatches()) {
            throw new InsufficientMatchesException(stage, matches.size(), params.getMinMatches());
        }
        return matches;
    }

    /**
     * Keeps, for every keypoint of the moving image, only its lowest-distance match.
     */
    static List<Correspondence> keepUnique(List<Correspondence> candidates) {
        Map<Integer, Correspondence> bestByTarget = new HashMap<>();
        for (Correspondence c : candidates) {
            Correspondence current = bestByTarget.get(c.getIndexB());
            if (current == null || c.getDistance() < current.getDistance()) {
                bestByTarget.put(c.getIndexB(), c);
            }
        }
        List<Correspondence> unique = new ArrayList<>(bestByTarget.values());
        unique.sort(Comparator.comparingInt(Correspondence::getIndexA));
        return unique;
    }
}
