package com.credit.card.fraud.scoring.artifact.service;

import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactStoreException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryArtifactStore implements ArtifactStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String modelVersion, String key) {
        return blobs.containsKey(modelVersion + "/" + key);
    }

    @Override
    public byte[] read(String modelVersion, String key) {
        byte[] content = blobs.get(modelVersion + "/" + key);
        if (content == null) {
            throw new ArtifactStoreException("Artifact not found: " + modelVersion + "/" + key);
        }
        return content.clone();
    }

    @Override
    public void write(String modelVersion, String key, byte[] content) {
        if (blobs.putIfAbsent(modelVersion + "/" + key, content.clone()) != null) {
            throw new ArtifactStoreException("Artifact already exists: " + modelVersion + "/" + key);
        }
    }

    /** 테스트에서 손상된 아티팩트를 만들 때만 쓴다 */
    public void overwrite(String modelVersion, String key, byte[] content) {
        blobs.put(modelVersion + "/" + key, content.clone());
    }

    public void remove(String modelVersion, String key) {
        blobs.remove(modelVersion + "/" + key);
    }

    public int size() {
        return blobs.size();
    }
}
