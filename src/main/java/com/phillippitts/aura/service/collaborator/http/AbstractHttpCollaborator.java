package com.phillippitts.aura.service.collaborator.http;

import com.phillippitts.aura.exception.CollaboratorException;
import com.phillippitts.aura.exception.CollaboratorExceptionBuilder;
import com.phillippitts.aura.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Base class for collaborators reached over HTTP.
 *
 * <p>Subclasses describe one request per operation through {@link #exchange}; this class times
 * the call and converts transport errors, non-2xx responses and unparseable bodies into
 * {@link CollaboratorException}s carrying status, duration and endpoint.
 *
 * <p><b>Thread Safety:</b> {@link RestClient} is thread-safe and this class holds no other
 * mutable state, so one instance serves all concurrent runs.
 */
public abstract class AbstractHttpCollaborator {

    private static final Logger LOG = LogManager.getLogger(AbstractHttpCollaborator.class);

    protected final RestClient restClient;
    private final String collaboratorName;

    protected AbstractHttpCollaborator(RestClient restClient, String collaboratorName) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.collaboratorName = Objects.requireNonNull(collaboratorName, "collaboratorName must not be null");
    }

    /**
     * Collaborator name used in logs and exception details.
     */
    public String collaboratorName() {
        return collaboratorName;
    }

    /**
     * Performs a request and returns the parsed JSON body.
     *
     * @param endpoint path, used for error context only
     * @param request  issues the request against {@link #restClient} and returns the raw body
     * @return the body as a JSON object
     * @throws CollaboratorException on transport failure, non-2xx status or invalid JSON
     */
    protected JSONObject exchange(String endpoint, Function<RestClient, String> request) {
        long t0 = System.nanoTime();
        String body;
        try {
            body = request.apply(restClient);
        } catch (RestClientResponseException e) {
            throw CollaboratorExceptionBuilder.create(collaboratorName + " request failed")
                    .collaborator(collaboratorName)
                    .status(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .metadata("endpoint", endpoint)
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw CollaboratorExceptionBuilder.create(collaboratorName + " unreachable")
                    .collaborator(collaboratorName)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .metadata("endpoint", endpoint)
                    .cause(e)
                    .build();
        }
        LOG.debug("{} {} answered in {} ms", collaboratorName, endpoint, TimeUtils.elapsedMillis(t0));
        if (body == null || body.isBlank()) {
            throw CollaboratorExceptionBuilder.create(collaboratorName + " returned an empty body")
                    .collaborator(collaboratorName)
                    .metadata("endpoint", endpoint)
                    .build();
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw CollaboratorExceptionBuilder.create(collaboratorName + " returned invalid JSON")
                    .collaborator(collaboratorName)
                    .metadata("endpoint", endpoint)
                    .cause(e)
                    .build();
        }
    }
}
