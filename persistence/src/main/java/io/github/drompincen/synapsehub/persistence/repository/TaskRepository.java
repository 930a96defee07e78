package io.github.drompincen.synapsehub.persistence.repository;

import io.github.drompincen.synapsehub.persistence.document.TaskDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface TaskRepository extends MongoRepository<TaskDocument, String>, TaskRepositoryCustom {
    boolean existsByTitleAndCreatedByAndDeletedFalse(String title, String createdBy);
}
