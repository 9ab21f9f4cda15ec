package com.filmdb.repository;

import java.util.List;

import com.filmdb.entity.Award;

/**
 * Basis für die Auszeichnungs-Repositories. Die Unterklassen nennen nur die Spalte der ausgezeichneten Person.
 */
public abstract class AwardRepository<T extends Award> extends BaseRepository<T, Integer> {

	private final String recipientField;

	protected AwardRepository(Class<T> entityClass, String recipientField) {
		super(entityClass);
		this.recipientField = recipientField;
	}

	/**
	 * Auszeichnungen einer Person, neuestes Jahr zuerst.
	 */
	public List<T> findByRecipientId(Integer recipientId) {
		return em.createQuery("select a from " + entityName() + " a where a." + recipientField
				+ " = :recipientId order by a.awardYear desc, a.awardName", entityClass())
				.setParameter("recipientId", recipientId)
				.getResultList();
	}

	public boolean exists(Integer recipientId, String awardName, Integer awardYear) {
		return em.createQuery("select count(a) from " + entityName() + " a where a." + recipientField
				+ " = :recipientId and a.awardName = :awardName and a.awardYear = :awardYear", Long.class)
				.setParameter("recipientId", recipientId)
				.setParameter("awardName", awardName)
				.setParameter("awardYear", awardYear)
				.getSingleResult() > 0;
	}

	public int deleteByRecipientId(Integer recipientId) {
		return deleteBy(recipientField, recipientId);
	}
}
