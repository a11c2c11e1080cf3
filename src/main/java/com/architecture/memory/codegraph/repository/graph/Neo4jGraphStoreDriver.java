package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.exception.ConfigurationException;
import com.architecture.memory.codegraph.exception.GraphWriteException;
import com.architecture.memory.codegraph.exception.QueryException;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.summary.SummaryCounters;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Graph store backed by Neo4j. Every entity is a {@code :CodeEntity} node carrying its kind as a
 * second label ({@code :Class}, {@code :Method}, ...) and tagged with {@code projectId}.
 */
@Slf4j
public class Neo4jGraphStoreDriver implements GraphStoreDriver {

    private static final String RELATIONSHIP_COLUMNS =
            "s.id AS sourceId, t.id AS targetId, type(r) AS type, r.confidence AS confidence, r.sourceLine AS sourceLine";

    private Driver driver;
    private String database;

    public Neo4jGraphStoreDriver() {
    }

    Neo4jGraphStoreDriver(Driver driver, String database) {
        this.driver = driver;
        this.database = database;
    }

    // ========================= LIFECYCLE =========================

    @Override
    public void connect(GraphStoreSettings settings) {
        log.info("[ckg-store] Connecting to Neo4j at: {}", settings.getUri());
        try {
            Config config = Config.builder()
                    .withConnectionTimeout(settings.getConnectionTimeoutMs(), TimeUnit.MILLISECONDS)
                    .build();
            driver = GraphDatabase.driver(settings.getUri(),
                    AuthTokens.basic(settings.getUsername(), settings.getPassword()), config);
            database = settings.getDatabase();
            driver.verifyConnectivity();
        } catch (Exception e) {
            close();
            throw new ConfigurationException("Graph store unreachable at " + settings.getUri(), e);
        }
        createIndexes();
    }

    @Override
    public boolean isConnected() {
        return driver != null;
    }

    @Override
    public String getName() {
        return "neo4j";
    }

    @Override
    public void close() {
        if (driver != null) {
            driver.close();
            driver = null;
            log.info("[ckg-store] Neo4j connection closed");
        }
    }

    private void createIndexes() {
        try (Session session = openSession()) {
            session.run("CREATE INDEX code_entity_key IF NOT EXISTS FOR (n:CodeEntity) ON (n.projectId, n.id)");
            session.run("CREATE INDEX code_entity_qualified_name IF NOT EXISTS FOR (n:CodeEntity) ON (n.projectId, n.qualifiedName)");
            session.run("CREATE INDEX code_entity_file IF NOT EXISTS FOR (n:CodeEntity) ON (n.projectId, n.filePath)");
            log.info("[ckg-store] Neo4j indexes ensured");
        } catch (Neo4jException e) {
            log.warn("[ckg-store] Failed to create indexes: {}", e.getMessage());
        }
    }

    // ========================= READS =========================

    @Override
    public List<Map<String, Object>> runRead(ReadQuery query, Map<String, Object> params) {
        requireConnected();
        String cypher = cypherFor(query);
        Map<String, Object> parameters = withListDefaults(params);
        try (Session session = openSession()) {
            return session.executeRead(tx -> {
                Result result = tx.run(cypher, parameters);
                List<Map<String, Object>> rows = new ArrayList<>();
                while (result.hasNext()) {
                    Record record = result.next();
                    rows.add(query.returnsEntities() ? record.get("entity").asMap() : record.asMap());
                }
                return rows;
            });
        } catch (Neo4jException e) {
            throw new QueryException("Neo4j read " + query + " failed: " + e.getMessage(), e);
        }
    }

    String cypherFor(ReadQuery query) {
        switch (query) {
            case ENTITY_BY_ID:
                return "MATCH (n:CodeEntity {projectId: $projectId, id: $id}) RETURN properties(n) AS entity";
            case ENTITIES_BY_IDS:
                return "MATCH (n:CodeEntity {projectId: $projectId}) WHERE n.id IN $ids "
                        + "RETURN properties(n) AS entity ORDER BY n.id";
            case ENTITIES_BY_QUALIFIED_NAME:
                return "MATCH (n:CodeEntity {projectId: $projectId, qualifiedName: $qualifiedName}) "
                        + "RETURN properties(n) AS entity ORDER BY n.id";
            case ENTITIES_BY_FILE:
                return "MATCH (n:CodeEntity {projectId: $projectId, filePath: $filePath}) "
                        + "RETURN properties(n) AS entity ORDER BY n.id";
            case PROJECT_ENTITIES:
                return "MATCH (n:CodeEntity {projectId: $projectId}) WHERE size($kinds) = 0 OR n.kind IN $kinds "
                        + "RETURN properties(n) AS entity ORDER BY n.id";
            case PROJECT_RELATIONSHIPS:
                return "MATCH (s:CodeEntity {projectId: $projectId})-[r]->(t:CodeEntity {projectId: $projectId}) "
                        + "WHERE size($types) = 0 OR type(r) IN $types "
                        + "RETURN " + RELATIONSHIP_COLUMNS + " ORDER BY sourceId, targetId, type";
            case OUTGOING_RELATIONSHIPS:
                return "MATCH (s:CodeEntity {projectId: $projectId})-[r]->(t:CodeEntity {projectId: $projectId}) "
                        + "WHERE s.id IN $ids AND (size($types) = 0 OR type(r) IN $types) "
                        + "RETURN " + RELATIONSHIP_COLUMNS + " ORDER BY sourceId, targetId, type";
            case INCOMING_RELATIONSHIPS:
                return "MATCH (s:CodeEntity {projectId: $projectId})-[r]->(t:CodeEntity {projectId: $projectId}) "
                        + "WHERE t.id IN $ids AND (size($types) = 0 OR type(r) IN $types) "
                        + "RETURN " + RELATIONSHIP_COLUMNS + " ORDER BY sourceId, targetId, type";
            case COUNT_ENTITIES_BY_KIND:
                return "MATCH (n:CodeEntity {projectId: $projectId}) RETURN n.kind AS kind, count(n) AS count";
            case COUNT_RELATIONSHIPS_BY_TYPE:
                return "MATCH (s:CodeEntity {projectId: $projectId})-[r]->(:CodeEntity {projectId: $projectId}) "
                        + "RETURN type(r) AS type, count(r) AS count";
            default:
                throw new IllegalArgumentException("Unsupported query: " + query);
        }
    }

    private Map<String, Object> withListDefaults(Map<String, Object> params) {
        Map<String, Object> parameters = new HashMap<>(params);
        parameters.putIfAbsent("kinds", List.of());
        parameters.putIfAbsent("types", List.of());
        parameters.putIfAbsent("ids", List.of());
        return parameters;
    }

    // ========================= WRITES =========================

    @Override
    public WriteResult runWrite(List<GraphStatement> statements) {
        requireConnected();
        try (Session session = openSession()) {
            return session.executeWrite(tx -> {
                WriteResult total = new WriteResult();
                for (GraphStatement statement : statements) {
                    SummaryCounters counters = apply(tx, statement);
                    total.setNodesCreated(total.getNodesCreated() + counters.nodesCreated());
                    total.setNodesDeleted(total.getNodesDeleted() + counters.nodesDeleted());
                    total.setRelationshipsCreated(total.getRelationshipsCreated() + counters.relationshipsCreated());
                    total.setRelationshipsDeleted(total.getRelationshipsDeleted() + counters.relationshipsDeleted());
                }
                return total;
            });
        } catch (Neo4jException e) {
            throw new GraphWriteException("Neo4j write transaction rolled back: " + e.getMessage(), e);
        }
    }

    private SummaryCounters apply(TransactionContext tx, GraphStatement statement) {
        Map<String, Object> params = new HashMap<>();
        params.put("projectId", statement.getProjectId());
        params.put("rows", statement.getRows());
        return tx.run(cypherFor(statement), params).consume().counters();
    }

    String cypherFor(GraphStatement statement) {
        switch (statement.getOperation()) {
            case DELETE_PROJECT:
                return "MATCH (n:CodeEntity {projectId: $projectId}) DETACH DELETE n";
            case CREATE_NODES:
                // labels come from the EntityKind enum, never from input
                return "UNWIND $rows AS row "
                        + "MERGE (n:CodeEntity {projectId: row.projectId, id: row.id}) "
                        + "SET n += row SET n:" + statement.getKind().getLabel();
            case CREATE_RELATIONSHIPS:
                return "UNWIND $rows AS row "
                        + "MATCH (s:CodeEntity {projectId: row.projectId, id: row.sourceId}) "
                        + "MATCH (t:CodeEntity {projectId: row.projectId, id: row.targetId}) "
                        + "MERGE (s)-[r:" + statement.getRelationshipType().name() + "]->(t) "
                        + "SET r.confidence = row.confidence, r.sourceLine = row.sourceLine, r.projectId = row.projectId";
            default:
                throw new IllegalArgumentException("Unsupported statement: " + statement.getOperation());
        }
    }

    private Session openSession() {
        return database != null && !database.isBlank()
                ? driver.session(SessionConfig.forDatabase(database))
                : driver.session();
    }

    private void requireConnected() {
        if (driver == null) {
            throw new IllegalStateException("Neo4j driver is not connected");
        }
    }
}
