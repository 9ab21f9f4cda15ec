package com.filmdb.entity.dto;

import com.filmdb.entity.UserRole;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class CreateUserRequestDTO {

	private String username;

	private String fullName;

	private String email;

	private UserRole role;
}
