package com.flagship.investment_ledger.withdrawal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Body of admin action and note endpoints. The note is optional for actions.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AdminNoteRequest {

    @JsonProperty("note")
    private String note;

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Required {

        @NotBlank(message = "Note is required")
        @JsonProperty("note")
        private String note;
    }
}
