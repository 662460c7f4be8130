package com.lineguard.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Invoice line that failed during the first run, kept on its session so a replay reports it again.
 * Lines rejected by input validation have no line item validation of their own; this is their only record.
 */
@NoArgsConstructor
@Getter
@Setter
public class FailedLine {

    private int itemIndex;
    private String lineItemId;
    private String errorCode;
    private String reason;
    private List<String> errors = new ArrayList<>();

    public static FailedLine of(int itemIndex, String lineItemId, String errorCode, String reason, List<String> errors) {
        FailedLine line = new FailedLine();
        line.setItemIndex(itemIndex);
        line.setLineItemId(lineItemId);
        line.setErrorCode(errorCode);
        line.setReason(reason);
        line.setErrors(errors != null ? new ArrayList<>(errors) : new ArrayList<>());
        return line;
    }
}
