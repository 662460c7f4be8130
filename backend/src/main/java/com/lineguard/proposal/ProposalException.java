package com.lineguard.proposal;

import lombok.Getter;

@Getter
public class ProposalException extends RuntimeException {

    private final String errorCode;

    public ProposalException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
