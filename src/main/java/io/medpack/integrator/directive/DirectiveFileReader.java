package io.medpack.integrator.directive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.medpack.integrator.exception.DirectiveFileException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the JSON directive file.
 */
@ApplicationScoped
public class DirectiveFileReader {

    private static final Logger logger = LoggerFactory.getLogger(DirectiveFileReader.class);

    private final ObjectMapper objectMapper;

    @Inject
    public DirectiveFileReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public DirectiveFileReader() {
        this(new ObjectMapper());
    }

    /**
     * Reads directives from a file.
     *
     * @throws DirectiveFileException if the file is unreadable or malformed
     */
    @NotNull
    public DirectiveFile read(@NotNull Path file) {
        try {
            DirectiveFile directives = objectMapper.readValue(file.toFile(), DirectiveFile.class);
            if (directives == null) {
                return DirectiveFile.empty();
            }
            logger.info("Read {} merge(s), {} reassignment(s) and {} department share(s) from {}",
                directives.merges().size(), directives.reassignments().size(),
                directives.departmentShares().size(), file);
            return directives;
        } catch (JsonProcessingException e) {
            throw new DirectiveFileException(file, "malformed directives: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DirectiveFileException(file, "cannot read file: " + e.getMessage(), e);
        }
    }
}
