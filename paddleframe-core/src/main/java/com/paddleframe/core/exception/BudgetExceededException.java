package com.paddleframe.core.exception;

import com.paddleframe.api.exception.PaddleFrameException;
import lombok.Getter;

/**
 * 应用效果前预算已耗尽
 */
@Getter
public class BudgetExceededException extends PaddleFrameException {

    private final double elapsedMs;
    private final double budgetMs;

    public BudgetExceededException(double elapsedMs, double budgetMs) {
        super(String.format("Time budget exceeded: %.3fms > %.3fms", elapsedMs, budgetMs));
        this.elapsedMs = elapsedMs;
        this.budgetMs = budgetMs;
    }
}
