package com.worker.lookup.rest.dto;

import com.worker.lookup.core.model.RankedResult;
import com.worker.lookup.core.model.Worker;

/**
 * One ranked worker in a search response.
 */
public record WorkerResultDto(
        long id,
        String firstName,
        String lastName,
        String email,
        String phone,
        int score,
        String matchTier
) {
    public static WorkerResultDto from(RankedResult<Worker> result) {
        Worker worker = result.item();
        return new WorkerResultDto(
                worker.id(),
                worker.firstName(),
                worker.lastName(),
                worker.email(),
                worker.phone(),
                result.score(),
                result.matchTier().name()
        );
    }
}
