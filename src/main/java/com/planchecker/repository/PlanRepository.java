package com.planchecker.repository;

import java.net.URI;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import com.planchecker.entity.PlanRecord;
import com.planchecker.exception.PlanCardinalityException;
import com.planchecker.exception.PlanNotFoundException;
import com.planchecker.exception.PlanStoreException;
import com.planchecker.exception.StoreNotConfiguredException;

/**
 * Speichert Plantexte unter einer zufälligen Referenz in der plans-Tabelle und liest sie wieder aus.
 *
 * <p>Jeder Aufruf öffnet und schließt seine eigene Verbindung. Die Eindeutigkeit der Referenz wird nicht
 * geprüft; Kollisionen fallen erst beim Lesen als {@link PlanCardinalityException} auf.
 */
@ApplicationScoped
public class PlanRepository {

	private static final Logger LOG = Logger.getLogger(PlanRepository.class);

	static final String REFERENCE_ALPHABET = "1234567890abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
	static final int REFERENCE_LENGTH = 8;

	private static final String INSERT_SQL = "insert into plans(ref, plantext) values (?, ?)";
	private static final String SELECT_BY_REF_SQL = "select id, ref, plantext, created_at from plans where ref = ?";

	@ConfigProperty(name = "planchecker.store.url")
	Optional<String> storeUrl;

	@ConfigProperty(name = "planchecker.store.username")
	Optional<String> storeUsername;

	@ConfigProperty(name = "planchecker.store.password")
	Optional<String> storePassword;

	private DataSource dataSource;
	private Random random;

	public PlanRepository() {
	}

	/**
	 * Erzeugt ein Repository mit fest vorgegebener Datenquelle; {@code null} entspricht "nicht konfiguriert".
	 */
	public PlanRepository(DataSource dataSource, Random random) {
		this.dataSource = dataSource;
		this.random = Objects.requireNonNull(random, "random");
	}

	@PostConstruct
	void initDataSource() {
		random = new Random();
		if (storeUrl.isEmpty()) {
			LOG.warn("planchecker.store.url not set (CONSTRING). No database configured, saving and loading plans is disabled");
			return;
		}

		PGSimpleDataSource pg;
		try {
			pg = createDataSource(storeUrl.get());
		} catch (IllegalArgumentException e) {
			// Meldung enthält die URL samt Passwort, daher nicht loggen
			LOG.error("planchecker.store.url (CONSTRING) is not a valid PostgreSQL connection URL. "
					+ "Saving and loading plans is disabled");
			return;
		}
		storeUsername.ifPresent(pg::setUser);
		storePassword.ifPresent(pg::setPassword);
		dataSource = pg;
		LOG.infof("Plan store configured for database %s", pg.getDatabaseName());
	}

	/**
	 * Baut die Datenquelle aus einer JDBC-URL ({@code jdbc:postgresql://...}) oder einer URL im libpq-Format
	 * ({@code postgres://user:pw@host:port/db?sslmode=...}); Benutzer und Passwort werden aus letzterer übernommen.
	 *
	 * @throws IllegalArgumentException wenn die URL nicht gelesen werden kann
	 */
	static PGSimpleDataSource createDataSource(String url) {
		PGSimpleDataSource pg = new PGSimpleDataSource();
		if (!url.startsWith("postgres://") && !url.startsWith("postgresql://")) {
			pg.setURL(url);
			return pg;
		}

		URI uri = URI.create(url);
		if (uri.getHost() == null) {
			throw new IllegalArgumentException("Missing host in store URL");
		}
		StringBuilder jdbcUrl = new StringBuilder("jdbc:postgresql://").append(uri.getHost());
		if (uri.getPort() > 0) {
			jdbcUrl.append(':').append(uri.getPort());
		}
		jdbcUrl.append(uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath());
		if (uri.getRawQuery() != null) {
			jdbcUrl.append('?').append(uri.getRawQuery());
		}
		pg.setURL(jdbcUrl.toString());

		String userInfo = uri.getUserInfo();
		if (userInfo != null) {
			int colon = userInfo.indexOf(':');
			pg.setUser(colon < 0 ? userInfo : userInfo.substring(0, colon));
			if (colon >= 0) {
				pg.setPassword(userInfo.substring(colon + 1));
			}
		}
		return pg;
	}

	public boolean isConfigured() {
		return dataSource != null;
	}

	/**
	 * Erzeugt eine 8-stellige Referenz aus Ziffern, Klein- und Großbuchstaben.
	 */
	public String generateReference() {
		char[] ref = new char[REFERENCE_LENGTH];
		for (int i = 0; i < ref.length; i++) {
			ref[i] = REFERENCE_ALPHABET.charAt(random.nextInt(REFERENCE_ALPHABET.length()));
		}
		return new String(ref);
	}

	/**
	 * Legt einen neuen Plan an. id und created_at werden von der Datenbank vergeben und zurückgelesen.
	 *
	 * @throws StoreNotConfiguredException wenn keine Datenbank konfiguriert ist
	 * @throws PlanStoreException          wenn das Schreiben fehlschlägt
	 */
	public PlanRecord insert(String text) {
		DataSource ds = requireDataSource();
		String ref = generateReference();

		try (Connection c = ds.getConnection();
				PreparedStatement stmt = c.prepareStatement(INSERT_SQL, new String[] { "id", "created_at" })) {
			stmt.setString(1, ref);
			stmt.setString(2, text);
			stmt.executeUpdate();

			try (ResultSet keys = stmt.getGeneratedKeys()) {
				if (!keys.next()) {
					throw new SQLException("Insert did not return the generated id");
				}
				return new PlanRecord(keys.getLong(1), ref, text, toLocalDateTime(keys.getTimestamp(2)));
			}
		} catch (SQLException e) {
			throw new PlanStoreException("Saving plan failed: " + e.getMessage(), e);
		}
	}

	/**
	 * Liest genau einen Plan anhand seiner Referenz.
	 *
	 * @throws StoreNotConfiguredException wenn keine Datenbank konfiguriert ist
	 * @throws PlanStoreException          bei Verbindungs-, Abfrage- oder Lesefehlern
	 * @throws PlanNotFoundException       wenn kein Datensatz existiert
	 * @throws PlanCardinalityException    wenn mehr als ein Datensatz existiert
	 */
	public PlanRecord fetchByRef(String ref) {
		DataSource ds = requireDataSource();
		List<PlanRecord> records = new ArrayList<>();

		try (Connection c = ds.getConnection(); PreparedStatement stmt = c.prepareStatement(SELECT_BY_REF_SQL)) {
			stmt.setString(1, ref);
			try (ResultSet rs = stmt.executeQuery()) {
				while (rs.next()) {
					records.add(new PlanRecord(
							rs.getLong("id"),
							rs.getString("ref"),
							rs.getString("plantext"),
							toLocalDateTime(rs.getTimestamp("created_at"))));
				}
			}
		} catch (SQLException e) {
			throw new PlanStoreException("Database query failed: " + e.getMessage(), e);
		}

		if (records.isEmpty()) {
			throw new PlanNotFoundException(ref);
		}
		if (records.size() > 1) {
			throw new PlanCardinalityException(ref, records.size());
		}
		return records.get(0);
	}

	private DataSource requireDataSource() {
		if (dataSource == null) {
			throw new StoreNotConfiguredException();
		}
		return dataSource;
	}

	private static LocalDateTime toLocalDateTime(Timestamp ts) {
		return ts == null ? null : ts.toLocalDateTime();
	}
}
