package io.github.drompincen.synapsehub.persistence.repository;

import io.github.drompincen.synapsehub.persistence.document.TaskDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

class TaskRepositoryImpl implements TaskRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    TaskRepositoryImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<TaskDocument> search(TaskQuery taskQuery) {
        Query query = filter(taskQuery)
                .with(Sort.by(taskQuery.descending() ? Sort.Direction.DESC : Sort.Direction.ASC, taskQuery.sortField()))
                .skip(taskQuery.skip())
                .limit(taskQuery.limit());
        return mongoTemplate.find(query, TaskDocument.class);
    }

    @Override
    public long countMatching(TaskQuery taskQuery) {
        return mongoTemplate.count(filter(taskQuery), TaskDocument.class);
    }

    private Query filter(TaskQuery q) {
        // several filters are $or clauses, so everything is combined under one $and
        List<Criteria> criteria = new ArrayList<>();
        if (!q.includeDeleted()) {
            criteria.add(Criteria.where("deleted").is(false));
        }
        if (q.searchTerm() != null && !q.searchTerm().isBlank()) {
            Pattern pattern = Pattern.compile(Pattern.quote(q.searchTerm().trim()), Pattern.CASE_INSENSITIVE);
            criteria.add(new Criteria().orOperator(
                    Criteria.where("title").regex(pattern),
                    Criteria.where("description").regex(pattern)));
        }
        if (q.status() != null) criteria.add(Criteria.where("status").is(q.status()));
        if (q.priority() != null) criteria.add(Criteria.where("priority").is(q.priority()));
        if (q.currentTurn() != null) criteria.add(Criteria.where("currentTurn").is(q.currentTurn()));
        if (q.createdBy() != null) criteria.add(Criteria.where("createdBy").is(q.createdBy()));
        if (q.remoteSsh() != null) {
            criteria.add(q.remoteSsh()
                    ? Criteria.where("sshHost").ne(null).and("sshUser").ne(null)
                    : new Criteria().orOperator(Criteria.where("sshHost").is(null), Criteria.where("sshUser").is(null)));
        }
        if (q.createdAfter() != null || q.createdBefore() != null) {
            Criteria created = Criteria.where("createdAt");
            if (q.createdAfter() != null) created = created.gte(q.createdAfter());
            if (q.createdBefore() != null) created = created.lte(q.createdBefore());
            criteria.add(created);
        }
        return criteria.isEmpty() ? new Query() : new Query(new Criteria().andOperator(criteria));
    }
}
