package turnstile.adapter.in.dto;

/**
 * Service identification returned from the root endpoint.
 *
 * @param name        service name
 * @param version     build version
 * @param description short description of the service
 */
public record ServiceInfoDto(String name, String version, String description) {}
