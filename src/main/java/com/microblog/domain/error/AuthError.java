package com.microblog.domain.error;

public sealed interface AuthError {

    record AuthenticationRequired() implements AuthError {
        public static final AuthenticationRequired INSTANCE = new AuthenticationRequired();

        @Override
        public String message() {
            return "An API key is required";
        }

        @Override
        public String code() {
            return "AUTHENTICATION_REQUIRED";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.AUTHENTICATION_REQUIRED;
        }
    }

    record InvalidCredential() implements AuthError {
        public static final InvalidCredential INSTANCE = new InvalidCredential();

        @Override
        public String message() {
            return "The API key is not valid";
        }

        @Override
        public String code() {
            return "INVALID_CREDENTIAL";
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.INVALID_CREDENTIAL;
        }
    }

    String message();

    String code();

    ErrorKind kind();
}
