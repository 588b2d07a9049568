package com.tessera.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/revert.
 */
public record RevertRequest(@JsonProperty("ledger_ids") List<String> ledgerIds) {}
