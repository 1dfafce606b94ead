package com.di.trialguard.contract;

/**
 * A data contract definition is invalid. Raised while a contract is constructed or loaded, before any
 * dataset is evaluated against it.
 */
public class MalformedContractException extends IllegalStateException {

    public MalformedContractException(String message) {
        super(message);
    }

    public MalformedContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
