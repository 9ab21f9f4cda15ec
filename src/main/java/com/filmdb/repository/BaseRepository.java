package com.filmdb.repository;

import java.util.List;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;

/**
 * Gemeinsame Basis für Repository-Klassen mit Zugriff auf den EntityManager und generischen CRUD-Hilfen.
 * Fremdschlüssel werden in den Entities nur als ID gehalten, daher bieten die Hilfsmethoden Suche,
 * Massenlöschung und Nullsetzen über einen einzelnen Spaltenwert.
 */
public abstract class BaseRepository<T, ID> {

	@Inject
	protected EntityManager em;

	private final Class<T> entityClass;

	protected BaseRepository(Class<T> entityClass) {
		this.entityClass = entityClass;
	}

	public Optional<T> findById(ID id) {
		if (id == null)
			return Optional.empty();
		return Optional.ofNullable(em.find(entityClass, id));
	}

	public boolean existsById(ID id) {
		return findById(id).isPresent();
	}

	public List<T> listAll() {
		return em.createQuery("select e from " + entityName() + " e order by e.id", entityClass).getResultList();
	}

	public void persist(T entity) {
		em.persist(entity);
	}

	/**
	 * Schreibt ausstehende Änderungen sofort, damit Constraint-Verletzungen noch in der Methode auftreten.
	 */
	public void flush() {
		em.flush();
	}

	public void delete(T entity) {
		em.remove(em.contains(entity) ? entity : em.merge(entity));
	}

	protected List<T> listBy(String field, Object value) {
		return em.createQuery("select e from " + entityName() + " e where e." + field + " = :value order by e.id",
				entityClass)
				.setParameter("value", value)
				.getResultList();
	}

	protected long countBy(String field, Object value) {
		return em.createQuery("select count(e) from " + entityName() + " e where e." + field + " = :value",
				Long.class)
				.setParameter("value", value)
				.getSingleResult();
	}

	protected boolean existsByPair(String firstField, Object firstValue, String secondField, Object secondValue) {
		return em.createQuery("select count(e) from " + entityName() + " e where e." + firstField + " = :first and e."
				+ secondField + " = :second", Long.class)
				.setParameter("first", firstValue)
				.setParameter("second", secondValue)
				.getSingleResult() > 0;
	}

	/**
	 * Löscht alle Zeilen, deren Spalte den Wert referenziert (ON DELETE CASCADE).
	 */
	protected int deleteBy(String field, Object value) {
		return em.createQuery("delete from " + entityName() + " e where e." + field + " = :value")
				.setParameter("value", value)
				.executeUpdate();
	}

	/**
	 * Setzt eine Referenzspalte auf null (ON DELETE SET NULL).
	 */
	protected int nullify(String field, Object value) {
		return em.createQuery("update " + entityName() + " e set e." + field + " = null where e." + field
				+ " = :value")
				.setParameter("value", value)
				.executeUpdate();
	}

	protected Class<T> entityClass() {
		return entityClass;
	}

	protected String entityName() {
		return entityClass.getSimpleName();
	}
}
