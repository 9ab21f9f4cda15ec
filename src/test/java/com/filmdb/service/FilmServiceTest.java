package com.filmdb.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.filmdb.entity.Film;
import com.filmdb.entity.FilmCertificate;
import com.filmdb.entity.FilmGenre;
import com.filmdb.entity.ProductionStatus;
import com.filmdb.entity.Scene;
import com.filmdb.exception.ConflictException;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.exception.ValidationException;
import com.filmdb.repository.DirectorRepository;
import com.filmdb.repository.FilmCertificateRepository;
import com.filmdb.repository.FilmGenreRepository;
import com.filmdb.repository.FilmRepository;
import com.filmdb.repository.SceneFilmingRepository;
import com.filmdb.repository.SceneRepository;

@ExtendWith(MockitoExtension.class)
class FilmServiceTest {

	@Mock
	FilmRepository filmRepository;

	@Mock
	DirectorRepository directorRepository;

	@Mock
	SceneRepository sceneRepository;

	@Mock
	SceneFilmingRepository sceneFilmingRepository;

	@Mock
	FilmCertificateRepository certificateRepository;

	@Mock
	FilmGenreRepository genreRepository;

	@Mock
	AuditService auditService;

	@Mock
	CastingService castingService;

	@Mock
	ProductionLinkService productionLinkService;

	@InjectMocks
	FilmService service;

	@BeforeEach
	void setUp() {
		service.validationService = Fixtures.validationService();
	}

	@Test
	@DisplayName("createFilm below minimum budget fails and persists nothing")
	void createFilm_shouldRejectLowBudget() {
		Film film = Fixtures.film(null, "Cheap", 99_000);

		assertThatThrownBy(() -> service.createFilm(film)).isInstanceOf(ValidationException.class);

		verify(filmRepository, never()).persist(any(Film.class));
	}

	@Test
	@DisplayName("createFilm with an unknown director fails with RecordNotFoundException")
	void createFilm_shouldRejectUnknownDirector() {
		Film film = Fixtures.film(null, "Orphan", 200_000);
		film.setDirectorId(42);
		when(directorRepository.existsById(42)).thenReturn(false);

		assertThatThrownBy(() -> service.createFilm(film)).isInstanceOf(RecordNotFoundException.class);
		verify(filmRepository, never()).persist(any(Film.class));
	}

	@Test
	@DisplayName("updateFilm lowering the budget below minimum leaves the stored film unchanged")
	void updateFilm_shouldLeaveFilmUnchanged_whenValidationFails() {
		// Arrange
		Film stored = Fixtures.film(1, "Nova", 500_000);
		when(filmRepository.findById(1)).thenReturn(Optional.of(stored));
		Film changes = Fixtures.film(null, "Nova (cut)", 10_000);

		// Act & Assert
		assertThatThrownBy(() -> service.updateFilm(1, changes)).isInstanceOf(ValidationException.class);
		assertThat(stored.getBudget()).isEqualByComparingTo("500000");
		assertThat(stored.getTitle()).isEqualTo("Nova");
		verify(auditService, never()).recordStatusChange(any(), any(), any());
	}

	@Test
	@DisplayName("changeProductionStatus hands old status and old budget to the audit")
	void changeProductionStatus_shouldAuditWithPriorState() {
		Film stored = Fixtures.film(1, "Nova", 500_000);
		when(filmRepository.findById(1)).thenReturn(Optional.of(stored));

		Film result = service.changeProductionStatus(1, ProductionStatus.IN_PROGRESS);

		assertThat(result.getProductionStatus()).isEqualTo(ProductionStatus.IN_PROGRESS);
		verify(auditService).recordStatusChange(stored, ProductionStatus.PRE_PRODUCTION, BigDecimal.valueOf(500_000));
	}

	@Test
	@DisplayName("deleteFilm removes roles through casting before links, scenes and the film itself")
	void deleteFilm_shouldCascadeInOrder() {
		Film stored = Fixtures.film(1, "Nova", 500_000);
		when(filmRepository.findById(1)).thenReturn(Optional.of(stored));

		service.deleteFilm(1);

		InOrder order = inOrder(castingService, productionLinkService, sceneRepository, certificateRepository,
				genreRepository, filmRepository);
		order.verify(castingService).removeRolesForFilm(1);
		order.verify(productionLinkService).deleteLinksForFilm(1);
		order.verify(sceneRepository).deleteByFilmId(1);
		order.verify(certificateRepository).deleteByFilmId(1);
		order.verify(genreRepository).deleteByFilmId(1);
		order.verify(filmRepository).delete(stored);
	}

	@Test
	@DisplayName("a second certificate for the same film is a conflict")
	void issueCertificate_shouldRejectSecondCertificate() {
		FilmCertificate certificate = new FilmCertificate();
		certificate.setFilmId(1);
		when(filmRepository.findById(1)).thenReturn(Optional.of(Fixtures.film(1, "Nova", 500_000)));
		when(certificateRepository.findByFilmId(1)).thenReturn(Optional.of(new FilmCertificate()));

		assertThatThrownBy(() -> service.issueCertificate(certificate)).isInstanceOf(ConflictException.class);
		verify(certificateRepository, never()).persist(any(FilmCertificate.class));
	}

	@Test
	@DisplayName("getFilm for an unknown id fails with a descriptive message")
	void getFilm_shouldFailForUnknownId() {
		when(filmRepository.findById(404)).thenReturn(Optional.empty());

		assertThatThrownBy(() -> service.getFilm(404))
				.isInstanceOf(RecordNotFoundException.class)
				.hasMessage("Film 404 not found");
	}

	// ==================== Szenen, Zertifikate und Genres ====================

	@Test
	@DisplayName("a scene cannot be changed to a negative duration")
	void updateScene_shouldRejectNegativeDuration() {
		Scene stored = new Scene();
		stored.setFilmId(1);
		stored.setDuration(4);
		when(sceneRepository.findById(11)).thenReturn(Optional.of(stored));
		Scene changes = new Scene();
		changes.setDuration(-2);

		assertThatThrownBy(() -> service.updateScene(11, changes)).isInstanceOf(ValidationException.class);
		assertThat(stored.getDuration()).isEqualTo(4);
	}

	@Test
	@DisplayName("a certificate cannot expire before it was issued")
	void updateCertificate_shouldRejectExpiryBeforeIssue() {
		FilmCertificate stored = new FilmCertificate();
		stored.setFilmId(1);
		stored.setCertificateRating("PG-13");
		when(certificateRepository.findByFilmId(1)).thenReturn(Optional.of(stored));
		FilmCertificate changes = new FilmCertificate();
		changes.setCertificateRating("R");
		changes.setIssueDate(LocalDate.of(2025, 5, 1));
		changes.setExpiryDate(LocalDate.of(2025, 4, 30));

		assertThatThrownBy(() -> service.updateCertificate(1, changes)).isInstanceOf(ValidationException.class);
		assertThat(stored.getCertificateRating()).isEqualTo("PG-13");
	}

	@Test
	@DisplayName("removing the primary genre also clears it on the film")
	void removeGenre_shouldClearPrimaryGenre() {
		Film film = Fixtures.film(1, "Nova", 500_000);
		film.setPrimaryGenre("Drama");
		FilmGenre genre = new FilmGenre();
		genre.setFilmId(1);
		genre.setGenre("Drama");
		when(filmRepository.findById(1)).thenReturn(Optional.of(film));
		when(genreRepository.findByFilmIdAndGenre(1, "Drama")).thenReturn(Optional.of(genre));

		service.removeGenre(1, " Drama ");

		verify(genreRepository).delete(genre);
		assertThat(film.getPrimaryGenre()).isNull();
	}

	@Test
	@DisplayName("removing a genre the film does not have fails")
	void removeGenre_shouldFailForMissingGenre() {
		when(filmRepository.findById(1)).thenReturn(Optional.of(Fixtures.film(1, "Nova", 500_000)));
		when(genreRepository.findByFilmIdAndGenre(1, "Horror")).thenReturn(Optional.empty());

		assertThatThrownBy(() -> service.removeGenre(1, "Horror"))
				.isInstanceOf(RecordNotFoundException.class)
				.hasMessage("Film 1 has no genre Horror");
	}
}
