package kr.jemi.zaccess.common.validation;

public interface SelfValidating {

    default void validateSelf() {
        ValidationUtils.validate(this);
    }
}
