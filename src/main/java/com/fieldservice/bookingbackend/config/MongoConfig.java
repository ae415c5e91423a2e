package com.fieldservice.bookingbackend.config;

import com.fieldservice.bookingbackend.model.ProfessionalStatus;
import com.fieldservice.bookingbackend.model.Role;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * Roles and statuses are stored by their lowercase value ("professional", "busy"),
 * the format the identity service writes.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(
                new RoleWritingConverter(),
                new RoleReadingConverter(),
                new StatusWritingConverter(),
                new StatusReadingConverter()
        ));
    }

    @WritingConverter
    static class RoleWritingConverter implements Converter<Role, String> {
        @Override
        public String convert(Role source) {
            return source.getValue();
        }
    }

    @ReadingConverter
    static class RoleReadingConverter implements Converter<String, Role> {
        @Override
        public Role convert(String source) {
            return Role.fromValue(source)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + source));
        }
    }

    @WritingConverter
    static class StatusWritingConverter implements Converter<ProfessionalStatus, String> {
        @Override
        public String convert(ProfessionalStatus source) {
            return source.getValue();
        }
    }

    @ReadingConverter
    static class StatusReadingConverter implements Converter<String, ProfessionalStatus> {
        @Override
        public ProfessionalStatus convert(String source) {
            return ProfessionalStatus.fromValue(source)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + source));
        }
    }
}
