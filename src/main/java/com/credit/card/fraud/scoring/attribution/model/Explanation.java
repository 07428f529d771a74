package com.credit.card.fraud.scoring.attribution.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Explanation {

    /** 참조 입력에서의 분류기 확률 */
    double baseline;

    /** 실제 입력에서의 분류기 확률 */
    double prediction;

    /** |기여도| 내림차순 상위 k개 */
    List<Attribution> attributions;
}
