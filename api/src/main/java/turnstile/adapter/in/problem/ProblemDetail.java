package turnstile.adapter.in.problem;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * RFC 7807 problem body. {@code provider} is only present for provider failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemDetail(String title, int status, String detail, String provider) {}
