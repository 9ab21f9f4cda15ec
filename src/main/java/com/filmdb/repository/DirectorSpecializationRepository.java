package com.filmdb.repository;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.DirectorSpecialization;

@ApplicationScoped
public class DirectorSpecializationRepository extends BaseRepository<DirectorSpecialization, Integer> {

	public DirectorSpecializationRepository() {
		super(DirectorSpecialization.class);
	}

	public List<DirectorSpecialization> findByDirectorId(Integer directorId) {
		return listBy("directorId", directorId);
	}

	public Optional<DirectorSpecialization> findByDirectorIdAndSpecialization(Integer directorId,
			String specialization) {
		return em.createQuery("select s from DirectorSpecialization s where s.directorId = :directorId"
				+ " and s.specialization = :specialization", DirectorSpecialization.class)
				.setParameter("directorId", directorId)
				.setParameter("specialization", specialization)
				.getResultStream()
				.findFirst();
	}

	public int deleteByDirectorId(Integer directorId) {
		return deleteBy("directorId", directorId);
	}
}
