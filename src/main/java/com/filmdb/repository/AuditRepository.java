package com.filmdb.repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import jakarta.persistence.TypedQuery;

/**
 * Basis für die Audit-Repositories: nur anhängen und lesen, keine Änderung oder Löschung.
 */
public abstract class AuditRepository<T> extends BaseRepository<T, Integer> {

	protected AuditRepository(Class<T> entityClass) {
		super(entityClass);
	}

	public void append(T entry) {
		em.persist(entry);
	}

	@Override
	public void delete(T entity) {
		throw new UnsupportedOperationException("Audit entries are append-only");
	}

	/**
	 * Sucht Einträge nach Gleichheitskriterien (null-Werte werden ignoriert) und optionalem Zeitfenster,
	 * neueste zuerst.
	 */
	protected List<T> listFiltered(Map<String, Object> criteria, Instant from, Instant to) {
		StringBuilder jpql = new StringBuilder("select e from ").append(entityName()).append(" e where 1 = 1");
		criteria.forEach((field, value) -> {
			if (value != null)
				jpql.append(" and e.").append(field).append(" = :").append(field);
		});
		if (from != null)
			jpql.append(" and e.loggedAt >= :from");
		if (to != null)
			jpql.append(" and e.loggedAt <= :to");
		jpql.append(" order by e.loggedAt desc, e.id desc");

		TypedQuery<T> query = em.createQuery(jpql.toString(), entityClass());
		criteria.forEach((field, value) -> {
			if (value != null)
				query.setParameter(field, value);
		});
		if (from != null)
			query.setParameter("from", from);
		if (to != null)
			query.setParameter("to", to);
		return query.getResultList();
	}
}
