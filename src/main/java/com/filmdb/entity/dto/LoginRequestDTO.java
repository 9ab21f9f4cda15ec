package com.filmdb.entity.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ergebnis eines Anmeldeversuchs, wie es die vorgelagerte Anmeldung meldet.
 */
@Data
@NoArgsConstructor
public class LoginRequestDTO {

	private String username;

	private boolean success;

	private String ipAddress;
}
