package io.github.drompincen.synapsehub.runtime.task;

import io.github.drompincen.synapsehub.runtime.error.ValidationException;

final class TaskFieldValidator {

    static final int TITLE_MAX = 255;
    static final int DESCRIPTION_MAX = 2000;
    static final int PROJECT_PATH_MAX = 500;
    static final int SSH_HOST_MAX = 255;
    static final int SSH_USER_MAX = 100;
    static final int MAX_ESTIMATED_DURATION = 86_400;
    static final int MAX_RETRIES_LIMIT = 10;

    private TaskFieldValidator() {}

    static String title(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title is required", "title");
        }
        String trimmed = title.trim();
        maxLength(trimmed, TITLE_MAX, "title");
        return trimmed;
    }

    static void maxLength(String value, int max, String field) {
        if (value != null && value.length() > max) {
            throw new ValidationException(field + " must be at most " + max + " characters", field);
        }
    }

    static void sshPair(String host, String user) {
        if ((host == null) != (user == null)) {
            throw new ValidationException("ssh_host and ssh_user must be provided together", "ssh_host");
        }
        maxLength(host, SSH_HOST_MAX, "ssh_host");
        maxLength(user, SSH_USER_MAX, "ssh_user");
    }

    static void estimatedDuration(Integer seconds) {
        if (seconds != null && (seconds < 1 || seconds > MAX_ESTIMATED_DURATION)) {
            throw new ValidationException("estimated_duration must be within 1.." + MAX_ESTIMATED_DURATION,
                    "estimated_duration");
        }
    }

    static void maxRetries(int maxRetries) {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new ValidationException("max_retries must be within 0.." + MAX_RETRIES_LIMIT, "max_retries");
        }
    }

    static void progress(int progress) {
        if (progress < 0 || progress > 100) {
            throw new ValidationException("progress must be within 0..100", "progress");
        }
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
