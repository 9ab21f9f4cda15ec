package com.filmdb.resource;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.filmdb.exception.ErrorKind;

class FilmDbExceptionMapperTest {

	@Test
	@DisplayName("each error kind maps to its own HTTP status")
	void statusOf_shouldMapEveryKind() {
		assertThat(FilmDbExceptionMapper.statusOf(ErrorKind.VALIDATION)).isEqualTo(400);
		assertThat(FilmDbExceptionMapper.statusOf(ErrorKind.AUTHORIZATION)).isEqualTo(403);
		assertThat(FilmDbExceptionMapper.statusOf(ErrorKind.NOT_FOUND)).isEqualTo(404);
		assertThat(FilmDbExceptionMapper.statusOf(ErrorKind.CONFLICT)).isEqualTo(409);
		assertThat(FilmDbExceptionMapper.statusOf(ErrorKind.INVARIANT)).isEqualTo(422);
	}
}
