package com.deltavault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Body of every owner-only call. {@code target} names the collaborator or account the
 * call installs: a strategy, a position manager or the new owner. Pause calls leave it empty.
 */
@Data
public class AdminRequest {

    @NotBlank
    private String caller;

    private String target;
}
