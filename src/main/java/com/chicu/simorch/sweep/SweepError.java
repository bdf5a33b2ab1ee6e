package com.chicu.simorch.sweep;

import com.chicu.simorch.common.error.ErrorKind;
import com.chicu.simorch.eval.EvaluationParams;
import lombok.Builder;

@Builder
public record SweepError(
        int index,          // позиция во входном списке
        String message,
        ErrorKind kind,
        String cause,       // класс исключения
        EvaluationParams params  // null, если конфиг не удалось разобрать
) {}
