package com.filmdb.repository;

import java.math.BigDecimal;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.ProducedBy;

/**
 * Repository für Produktionsbeteiligungen.
 */
@ApplicationScoped
public class ProducedByRepository extends BaseRepository<ProducedBy, Integer> {

	public ProducedByRepository() {
		super(ProducedBy.class);
	}

	public List<ProducedBy> findByProducerId(Integer producerId) {
		return listBy("producerId", producerId);
	}

	public List<ProducedBy> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public boolean existsByFilmAndProducer(Integer filmId, Integer producerId) {
		return existsByPair("filmId", filmId, "producerId", producerId);
	}

	/**
	 * Summe aller Investitionen eines Produzenten, 0 ohne Beteiligung.
	 */
	public BigDecimal sumInvestmentByProducerId(Integer producerId) {
		BigDecimal sum = em.createQuery("select sum(p.investment) from ProducedBy p where p.producerId = :producerId",
				BigDecimal.class)
				.setParameter("producerId", producerId)
				.getSingleResult();
		return sum == null ? BigDecimal.ZERO : sum;
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}

	public int deleteByProducerId(Integer producerId) {
		return deleteBy("producerId", producerId);
	}
}
