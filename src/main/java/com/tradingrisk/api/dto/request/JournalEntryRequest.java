package com.tradingrisk.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Request to save an assessment to the journal. The assessment is re-evaluated server-side so the
 * stored decision always matches the stored answers.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JournalEntryRequest {

    @NotNull
    @Valid
    private EvaluationRequest assessment;

    @Size(max = 2000)
    private String notes;
}
