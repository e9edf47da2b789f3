package io.lighting.quill.view;

import io.lighting.quill.value.Value;

/**
 * Request-scoped namespaces for one render call: {@code R}, {@code session}, {@code query},
 * {@code user}, the request URL and hostname, and the language used for translations.
 */
public record ViewRequest(
    Value repository,
    Value session,
    Value query,
    Value user,
    String url,
    String hostname,
    String language
) {
    private static final ViewRequest EMPTY = new ViewRequest(null, null, null, null, null, null, null);

    public ViewRequest {
        repository = repository == null ? Value.NULL : repository;
        session = session == null ? Value.NULL : session;
        query = query == null ? Value.NULL : query;
        user = user == null ? Value.NULL : user;
        url = url == null ? "" : url;
        hostname = hostname == null ? "" : hostname;
    }

    public static ViewRequest empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Value repository;
        private Value session;
        private Value query;
        private Value user;
        private String url;
        private String hostname;
        private String language;

        private Builder() {
        }

        public Builder repository(Value repository) {
            this.repository = repository;
            return this;
        }

        public Builder session(Value session) {
            this.session = session;
            return this;
        }

        public Builder query(Value query) {
            this.query = query;
            return this;
        }

        public Builder user(Value user) {
            this.user = user;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public ViewRequest build() {
            return new ViewRequest(repository, session, query, user, url, hostname, language);
        }
    }
}
