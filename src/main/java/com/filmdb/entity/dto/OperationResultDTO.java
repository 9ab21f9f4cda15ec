package com.filmdb.entity.dto;

/**
 * Textuelle Rückmeldung einer Geschäftsoperation.
 */
public record OperationResultDTO(String message) {
}
