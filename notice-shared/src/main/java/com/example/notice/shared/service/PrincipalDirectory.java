package com.example.notice.shared.service;

import com.example.notice.shared.model.Recipient;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the principals that exist: ordinary users and organization administrators.
 * A {@code null} company id means "no organization filter".
 */
public interface PrincipalDirectory {

    Optional<String> findUserRole(String userId);

    /** Active users, excluding super administrators. */
    List<Recipient> findActiveUsers(String companyId);

    /** Active organization administrators. */
    List<Recipient> findActiveCompanyAdmins(String companyId);
}
