package com.filmdb.repository;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Crew;

/**
 * Repository für Crew-Mitglieder inklusive der Vorgesetzten-Beziehung.
 */
@ApplicationScoped
public class CrewRepository extends BaseRepository<Crew, Integer> {

	public CrewRepository() {
		super(Crew.class);
	}

	public List<Crew> findBySupervisorId(Integer supervisorId) {
		return listBy("supervisorId", supervisorId);
	}

	public int clearSupervisor(Integer supervisorId) {
		return nullify("supervisorId", supervisorId);
	}
}
