package com.ntth.showtime_builder.repositoryImpl;

import com.ntth.showtime_builder.Config.ShowtimeProperties;
import com.ntth.showtime_builder.pojo.PersistedState;
import com.ntth.showtime_builder.repository.KeyValueStore;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public class MongoKeyValueStore implements KeyValueStore {

    private final MongoTemplate mongo;
    private final String collection;

    public MongoKeyValueStore(MongoTemplate mongo, ShowtimeProperties props) {
        this.mongo = mongo;
        this.collection = props.getStateCollection();
    }

    @Override
    public Optional<String> load(String key) {
        PersistedState doc = mongo.findById(key, PersistedState.class, collection);
        return Optional.ofNullable(doc).map(PersistedState::getJson);
    }

    /** Upsert {_id: key, json, updatedAt} */
    @Override
    @Retryable(retryFor = {DataAccessResourceFailureException.class}, maxAttempts = 3, backoff = @Backoff(delay = 500))
    public void save(String key, String json) {
        Query q = new Query(Criteria.where("_id").is(key));
        Update u = new Update()
                .set("json", json)
                .set("updatedAt", Instant.now());
        mongo.upsert(q, u, PersistedState.class, collection);
    }

    @Override
    @Retryable(retryFor = {DataAccessResourceFailureException.class}, maxAttempts = 3, backoff = @Backoff(delay = 500))
    public void delete(String key) {
        mongo.remove(new Query(Criteria.where("_id").is(key)), PersistedState.class, collection);
    }
}
