package com.example.notice.admin.service;

import com.example.notice.shared.exception.BroadcastValidationException;
import com.example.notice.shared.model.Recipient;
import com.example.notice.shared.service.PrincipalDirectory;
import com.example.notice.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipientResolver {

    private final PrincipalDirectory principalDirectory;

    /**
     * Active users (minus super administrators) plus active organization admins, either everywhere
     * or within one organization. Not deduplicated: a principal present in both directories is
     * returned twice.
     */
    public List<Recipient> resolveRecipients(Constants.TargetMode targetMode, String organizationId) {
        String companyFilter = null;
        if (targetMode == Constants.TargetMode.COMPANY) {
            if (organizationId == null || organizationId.isBlank()) {
                throw new BroadcastValidationException("organizationId is required to resolve COMPANY recipients");
            }
            companyFilter = organizationId;
        }

        List<Recipient> users = principalDirectory.findActiveUsers(companyFilter);
        List<Recipient> admins = principalDirectory.findActiveCompanyAdmins(companyFilter);

        List<Recipient> recipients = new ArrayList<>(users.size() + admins.size());
        recipients.addAll(users);
        recipients.addAll(admins);
        log.debug("Resolved {} users and {} company admins for {} {}",
                users.size(), admins.size(), targetMode, companyFilter == null ? "" : companyFilter);
        return recipients;
    }
}
