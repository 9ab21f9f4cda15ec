package com.filmdb.repository;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;

import com.filmdb.entity.UserAccount;
import com.filmdb.entity.UserRole;

/**
 * Repository für Benutzerkonten.
 */
@ApplicationScoped
public class UserAccountRepository extends BaseRepository<UserAccount, String> {

	public UserAccountRepository() {
		super(UserAccount.class);
	}

	/**
	 * Alle Konten, neueste zuerst.
	 */
	@Override
	public List<UserAccount> listAll() {
		return em.createQuery("select u from UserAccount u order by u.createdAt desc, u.username", UserAccount.class)
				.getResultList();
	}

	public Optional<UserAccount> findByEmail(String email) {
		return em.createQuery("select u from UserAccount u where u.email = :email", UserAccount.class)
				.setParameter("email", email)
				.getResultStream()
				.findFirst();
	}

	public long count() {
		return em.createQuery("select count(u) from UserAccount u", Long.class).getSingleResult();
	}

	/**
	 * Liest alle aktiven Admins mit Schreibsperre. Muss in derselben Transaktion wie die nachfolgende Änderung
	 * aufgerufen werden, damit parallele Löschungen serialisiert werden.
	 */
	public List<UserAccount> lockActiveAdmins() {
		return em.createQuery("select u from UserAccount u where u.role = :role and u.active = true order by u.username",
				UserAccount.class)
				.setParameter("role", UserRole.ADMIN)
				.setLockMode(LockModeType.PESSIMISTIC_WRITE)
				.getResultList();
	}
}
