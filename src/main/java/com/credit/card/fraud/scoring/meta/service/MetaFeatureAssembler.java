package com.credit.card.fraud.scoring.meta.service;

import com.credit.card.fraud.scoring.artifact.dto.ModelFeatureContracts;
import com.credit.card.fraud.scoring.ensemble.service.BaseSignalSet;
import com.credit.card.fraud.scoring.features.model.EngineeredFeatureVector;
import com.credit.card.fraud.scoring.meta.exceptions.MetaFeatureContractViolationException;
import com.credit.card.fraud.scoring.meta.model.MetaFeatureSlots;
import com.credit.card.fraud.scoring.meta.model.MetaFeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalInt;

/**
 * 베이스 신호 + 선택된 엔지니어링 피처 -> 스태커 입력.
 * 학습과 서빙이 같은 슬롯 배치를 쓰며, 감독 신호 슬롯만 출처가 다르다 (OOF 확률 / 실시간 확률).
 */
@Slf4j
@Component
public class MetaFeatureAssembler {

    public MetaFeatureVector assembleForServing(BaseSignalSet signals,
                                                EngineeredFeatureVector vector,
                                                ModelFeatureContracts contracts) {
        return assemble(signals, vector, contracts.getMetaEngineeredFeatures(), contracts.getMetaFeatures());
    }

    /**
     * 학습 측 조립. 감독 신호 슬롯에 out-of-fold 확률을 넣는다.
     */
    public MetaFeatureVector assembleForTraining(double oofProbability,
                                                 BaseSignalSet signals,
                                                 EngineeredFeatureVector vector,
                                                 ModelFeatureContracts contracts) {
        BaseSignalSet withOof = BaseSignalSet.builder()
                .supervisedProbability(oofProbability)
                .anomalyScore(signals.getAnomalyScore())
                .reconstructionError(signals.getReconstructionError())
                .clusterId(signals.getClusterId())
                .latent(signals.getLatent())
                .build();
        return assemble(withOof, vector, contracts.getMetaEngineeredFeatures(), contracts.getMetaFeatures());
    }

    public MetaFeatureVector assemble(BaseSignalSet signals,
                                      EngineeredFeatureVector vector,
                                      List<String> namedSubset,
                                      List<String> fixedOrder) {
        if (fixedOrder == null || fixedOrder.isEmpty()) {
            throw new MetaFeatureContractViolationException("Meta feature order is empty.", List.of(), List.of());
        }
        List<String> subset = namedSubset != null ? namedSubset : List.of();
        List<String> expectedSubset = fixedOrder.stream()
                .filter(name -> !MetaFeatureSlots.isSignal(name))
                .toList();
        if (!expectedSubset.equals(subset)) {
            log.error("Meta feature subset does not match stacker order: expected={} actual={}",
                    expectedSubset, subset);
            throw new MetaFeatureContractViolationException(
                    "Engineered meta features differ from stacker order.", expectedSubset, subset);
        }

        double[] values = new double[fixedOrder.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = slotValue(fixedOrder.get(i), signals, vector, fixedOrder);
        }
        return new MetaFeatureVector(fixedOrder, values);
    }

    private double slotValue(String name, BaseSignalSet signals, EngineeredFeatureVector vector,
                             List<String> fixedOrder) {
        switch (name) {
            case MetaFeatureSlots.SUPERVISED_PROBABILITY:
                return signals.getSupervisedProbability();
            case MetaFeatureSlots.ANOMALY_SCORE:
                return signals.getAnomalyScore();
            case MetaFeatureSlots.RECONSTRUCTION_ERROR:
                return signals.getReconstructionError();
            case MetaFeatureSlots.CLUSTER_ID:
                return signals.getClusterId();
            default:
                break;
        }
        OptionalInt latentIndex = MetaFeatureSlots.latentIndex(name);
        if (latentIndex.isPresent()) {
            int index = latentIndex.getAsInt();
            if (index >= signals.getLatent().size()) {
                throw new MetaFeatureContractViolationException(
                        "Latent slot '" + name + "' exceeds embedding size " + signals.getLatent().size() + ".",
                        fixedOrder, fixedOrder);
            }
            return signals.getLatent().get(index);
        }
        return vector.numeric(name);
    }
}
