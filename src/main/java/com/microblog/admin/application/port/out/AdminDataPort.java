package com.microblog.admin.application.port.out;

/**
 * Cross-cutting read access for operators, so the admin module does not
 * depend on every repository.
 */
public interface AdminDataPort {

    DataCounts getCounts();

    record DataCounts(
        long users,
        long tweets,
        long follows,
        long likes,
        long media
    ) {}
}
