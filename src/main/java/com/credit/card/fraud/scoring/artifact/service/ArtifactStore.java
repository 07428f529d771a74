package com.credit.card.fraud.scoring.artifact.service;

/**
 * (모델 버전, 키) 단위의 blob 저장소. 한 번 쓴 키는 다시 쓸 수 없다.
 */
public interface ArtifactStore {

    boolean exists(String modelVersion, String key);

    byte[] read(String modelVersion, String key);

    void write(String modelVersion, String key, byte[] content);
}
