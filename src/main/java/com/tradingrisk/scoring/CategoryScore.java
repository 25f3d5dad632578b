package com.tradingrisk.scoring;

import java.util.List;
import lombok.Value;

/**
 * Weighted mean score of one category and the answers that produced it, in question order.
 */
@Value
public class CategoryScore {

    String category;
    double score;
    List<AnswerRecord> answers;
}
