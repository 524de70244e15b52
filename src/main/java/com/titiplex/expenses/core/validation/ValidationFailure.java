package com.titiplex.expenses.core.validation;

public record ValidationFailure(Kind kind, String field, String message) {

    public enum Kind {
        INVALID_AMOUNT, INVALID_DATE, EMPTY_CATEGORY, EMPTY_DESCRIPTION
    }
}
