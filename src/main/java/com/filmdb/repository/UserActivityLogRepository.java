package com.filmdb.repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.UserActivityLog;

/**
 * Repository für das Aktivitätsprotokoll der Benutzerverwaltung.
 */
@ApplicationScoped
public class UserActivityLogRepository extends AuditRepository<UserActivityLog> {

	public UserActivityLogRepository() {
		super(UserActivityLog.class);
	}

	public List<UserActivityLog> find(String username, Instant from, Instant to) {
		Map<String, Object> criteria = new LinkedHashMap<>();
		criteria.put("username", username);
		return listFiltered(criteria, from, to);
	}

	/**
	 * Liefert je Benutzer: Anzahl Aktivitäten, letzte Aktivität, erfolgreiche und fehlgeschlagene Logins.
	 */
	public List<Object[]> summarizeByUsername() {
		return em.createQuery("select l.username, count(l), max(l.loggedAt),"
				+ " sum(case when l.actionType = com.filmdb.entity.UserActivityType.LOGIN_SUCCESS then 1 else 0 end),"
				+ " sum(case when l.actionType = com.filmdb.entity.UserActivityType.LOGIN_FAILED then 1 else 0 end)"
				+ " from UserActivityLog l group by l.username", Object[].class)
				.getResultList();
	}
}
