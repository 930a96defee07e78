package io.github.drompincen.synapsehub.gateway.config;

import io.github.drompincen.synapsehub.protocol.api.MessageSender;
import io.github.drompincen.synapsehub.protocol.api.TaskPriority;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;
import io.github.drompincen.synapsehub.protocol.cursor.CommandType;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Query and path parameters use the same lowercase enum values as the JSON bodies. */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, TaskStatus.class, (Converter<String, TaskStatus>) TaskStatus::fromValue);
        registry.addConverter(String.class, TaskPriority.class, (Converter<String, TaskPriority>) TaskPriority::fromValue);
        registry.addConverter(String.class, TaskTurn.class, (Converter<String, TaskTurn>) TaskTurn::fromValue);
        registry.addConverter(String.class, MessageSender.class, (Converter<String, MessageSender>) MessageSender::fromValue);
        registry.addConverter(String.class, CommandType.class, (Converter<String, CommandType>) CommandType::fromValue);
    }
}
