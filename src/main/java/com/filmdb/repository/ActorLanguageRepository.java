package com.filmdb.repository;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.ActorLanguage;

/**
 * Repository für die Sprachen der Schauspieler.
 */
@ApplicationScoped
public class ActorLanguageRepository extends BaseRepository<ActorLanguage, Integer> {

	public ActorLanguageRepository() {
		super(ActorLanguage.class);
	}

	public List<ActorLanguage> findByActorId(Integer actorId) {
		return listBy("actorId", actorId);
	}

	public Optional<ActorLanguage> findByActorIdAndLanguage(Integer actorId, String language) {
		return em.createQuery("select l from ActorLanguage l where l.actorId = :actorId and l.language = :language",
				ActorLanguage.class)
				.setParameter("actorId", actorId)
				.setParameter("language", language)
				.getResultStream()
				.findFirst();
	}

	public int deleteByActorId(Integer actorId) {
		return deleteBy("actorId", actorId);
	}
}
