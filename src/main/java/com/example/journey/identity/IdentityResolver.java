package com.example.journey.identity;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 跨轨迹身份识别
 * <p>
 * 维护 轨迹ID -> 全局人员ID 缓存，以及 全局人员ID -> 代表特征（gallery）。
 * 新轨迹按余弦相似度与gallery比对，达到阈值则复用身份，否则创建新身份。
 * 单线程使用，不做同步。
 */
@Slf4j
public class IdentityResolver {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.62;

    /** gallery 平滑系数 */
    private static final double GALLERY_MOMENTUM = 0.8;

    private final Map<Integer, Integer> trackToPerson = new HashMap<>();

    /** 按ID递增顺序，比对时ID小者优先 */
    private final Map<Integer, float[]> gallery = new LinkedHashMap<>();

    private int nextPersonId = 1;

    @Getter
    private double similarityThreshold;

    public IdentityResolver() {
        this(DEFAULT_SIMILARITY_THRESHOLD);
    }

    public IdentityResolver(double similarityThreshold) {
        setSimilarityThreshold(similarityThreshold);
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        if (similarityThreshold <= 0 || similarityThreshold > 1) {
            throw new IllegalArgumentException("相似度阈值必须在(0,1]之间: " + similarityThreshold);
        }
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * 为轨迹分配全局人员ID
     */
    public int assignIdentity(int trackId, float[] embedding) {
        Integer cached = trackToPerson.get(trackId);
        if (cached != null) {
            updateGallery(cached, embedding);
            return cached;
        }

        float[] normalized = Embeddings.normalize(embedding);
        int bestPersonId = -1;
        double bestSimilarity = -1.0;
        for (Map.Entry<Integer, float[]> entry : gallery.entrySet()) {
            double similarity = Embeddings.cosineSimilarity(normalized, entry.getValue());
            if (similarity > bestSimilarity) {
                bestSimilarity = similarity;
                bestPersonId = entry.getKey();
            }
        }

        if (bestPersonId > 0 && bestSimilarity >= similarityThreshold) {
            trackToPerson.put(trackId, bestPersonId);
            updateGallery(bestPersonId, normalized);
            log.debug("轨迹 #{} 匹配到人员 {} (相似度 {})", trackId, bestPersonId,
                    String.format("%.3f", bestSimilarity));
            return bestPersonId;
        }

        int personId = nextPersonId++;
        gallery.put(personId, normalized);
        trackToPerson.put(trackId, personId);
        log.info("🆕 新身份 {} (轨迹 #{})", personId, trackId);
        return personId;
    }

    /**
     * 已解析的轨迹对应的人员ID
     */
    public Optional<Integer> personOf(int trackId) {
        return Optional.ofNullable(trackToPerson.get(trackId));
    }

    /**
     * 人员的代表特征副本
     */
    public Optional<float[]> galleryOf(int personId) {
        float[] vector = gallery.get(personId);
        return vector == null ? Optional.empty() : Optional.of(vector.clone());
    }

    public int identityCount() {
        return gallery.size();
    }

    /**
     * 清理已过期轨迹的缓存；轨迹ID不复用，清理不影响后续结果
     */
    public void retainTracks(Collection<Integer> liveTrackIds) {
        trackToPerson.keySet().retainAll(liveTrackIds);
    }

    private void updateGallery(int personId, float[] sample) {
        if (sample == null || sample.length == 0) {
            return;
        }
        float[] current = gallery.get(personId);
        if (current == null || current.length == 0) {
            gallery.put(personId, Embeddings.normalize(sample));
            return;
        }
        if (current.length != sample.length) {
            log.debug("人员 {} 特征维度不一致({} vs {})，跳过更新", personId, current.length, sample.length);
            return;
        }
        gallery.put(personId, Embeddings.blend(current, sample, GALLERY_MOMENTUM));
    }
}
