package io.github.riemr.assign.application.dto;

/** リクエストで受け付ける識別子の書式 */
final class Identifiers {
    static final String UUID_PATTERN =
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

    private Identifiers() {}
}
