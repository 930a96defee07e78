package io.github.drompincen.synapsehub.persistence.repository;

import io.github.drompincen.synapsehub.persistence.document.MessageDocument;
import io.github.drompincen.synapsehub.protocol.api.MessageSender;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

class MessageRepositoryImpl implements MessageRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    MessageRepositoryImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<MessageDocument> findWindow(String taskId, MessageSender sender, boolean ascending, int skip, int limit) {
        Query query = filter(taskId, sender)
                .with(Sort.by(ascending ? Sort.Direction.ASC : Sort.Direction.DESC, "seq"))
                .skip(skip)
                .limit(limit);
        return mongoTemplate.find(query, MessageDocument.class);
    }

    @Override
    public long countBySender(String taskId, MessageSender sender) {
        return mongoTemplate.count(filter(taskId, sender), MessageDocument.class);
    }

    private Query filter(String taskId, MessageSender sender) {
        Query query = new Query().addCriteria(Criteria.where("taskId").is(taskId));
        if (sender != null) query.addCriteria(Criteria.where("sender").is(sender));
        return query;
    }
}
