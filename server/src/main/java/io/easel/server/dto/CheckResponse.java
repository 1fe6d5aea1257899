package io.easel.server.dto;

/** JSON response for GET /images/check. */
public class CheckResponse {
    public String url;
    public boolean valid;
}
