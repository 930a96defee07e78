package io.github.drompincen.synapsehub.persistence.repository;

import io.github.drompincen.synapsehub.persistence.document.TaskDocument;

import java.util.List;

public interface TaskRepositoryCustom {
    List<TaskDocument> search(TaskQuery query);
    long countMatching(TaskQuery query);
}
