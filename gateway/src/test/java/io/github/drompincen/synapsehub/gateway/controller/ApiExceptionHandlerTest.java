package io.github.drompincen.synapsehub.gateway.controller;

import io.github.drompincen.synapsehub.gateway.config.JacksonConfig;
import io.github.drompincen.synapsehub.gateway.config.WebMvcConfig;
import io.github.drompincen.synapsehub.protocol.api.ApiError;
import io.github.drompincen.synapsehub.protocol.api.TaskPage;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.runtime.error.BusinessLogicException;
import io.github.drompincen.synapsehub.runtime.error.ConfigurationException;
import io.github.drompincen.synapsehub.runtime.error.DuplicateException;
import io.github.drompincen.synapsehub.runtime.error.ExternalServiceException;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import io.github.drompincen.synapsehub.runtime.task.TaskService;
import org.junit.jupiter.api.Test;
import org.springframework.format.support.DefaultFormattingConversionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void taxonomyMapsToStatuses() {
        assertThat(handler.handleHub(new ValidationException("bad", "title")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(handler.handleHub(new NotFoundException("Task", "T1")).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.handleHub(new DuplicateException("dup", "title", "x")).getStatusCode())
                .isEqualTo(HttpStatus.CONFLICT);
        assertThat(handler.handleHub(new BusinessLogicException("no", "invalid_transition")).getStatusCode())
                .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(handler.handleHub(new ExternalServiceException("down", "cursor")).getStatusCode())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(handler.handleHub(new ConfigurationException("off", "synapsehub.cursor.enable-ssh-context"))
                .getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void bodyCarriesCodeAndDetails() {
        ResponseEntity<ApiError> response = handler.handleHub(new BusinessLogicException("Invalid transition",
                "invalid_transition"));

        assertThat(response.getBody().errorCode()).isEqualTo("BUSINESS_RULE_VIOLATION");
        assertThat(response.getBody().details()).containsEntry("rule", "invalid_transition");
    }

    @Test
    void unexpectedErrorsHideTheirMessage() {
        ResponseEntity<ApiError> response = handler.handleUnexpected(new NullPointerException("secret detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(response.getBody().message()).doesNotContain("secret");
    }

    private static MockMvc mvc(TaskService taskService) {
        DefaultFormattingConversionService conversions = new DefaultFormattingConversionService();
        new WebMvcConfig().addFormatters(conversions);
        return MockMvcBuilders.standaloneSetup(new TaskController(taskService))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new JacksonConfig().objectMapper()))
                .setConversionService(conversions)
                .build();
    }

    @Test
    void lowercaseEnumQueryParametersBind() throws Exception {
        TaskService taskService = mock(TaskService.class);
        when(taskService.list(any())).thenReturn(TaskPage.of(List.of(), 0, 0, 20));

        mvc(taskService).perform(get("/tasks").param("status", "processing_cursor"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.has_next").value(false));

        verify(taskService).list(argThat(q -> q.status() == TaskStatus.PROCESSING_CURSOR));
    }

    @Test
    void unknownEnumValueIsBadRequest() throws Exception {
        TaskService taskService = mock(TaskService.class);

        mvc(taskService).perform(get("/tasks").param("status", "sleeping"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.field").value("status"));
        verifyNoInteractions(taskService);
    }

    @Test
    void businessRuleViolationIs422() throws Exception {
        TaskService taskService = mock(TaskService.class);
        when(taskService.complete(eq("T1"), any()))
                .thenThrow(new BusinessLogicException("Invalid status transition", "invalid_transition"));

        mvc(taskService).perform(post("/tasks/T1/complete").header(Actors.HEADER, "alice"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("Invalid status transition"));
    }

    @Test
    void missingRequiredParameterIsBadRequest() throws Exception {
        mvc(mock(TaskService.class)).perform(post("/tasks/T1/fail"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field").value("error_message"));
    }
}
