package com.lineguard.api.dto;

import com.lineguard.pipeline.LineResult;
import com.lineguard.pipeline.RevalidationResult;

public record RevalidateResponse(LineResult line, int stagesRun, int attempts) {

    public static RevalidateResponse of(RevalidationResult result) {
        return new RevalidateResponse(result.line(), result.stagesRun(), result.attempts());
    }
}
