package com.example.notice.shared.repository;

import com.example.notice.shared.model.Recipient;
import com.example.notice.shared.service.PrincipalDirectory;
import com.example.notice.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcPrincipalDirectory implements PrincipalDirectory {

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<Recipient> recipientMapper = (rs, rowNum) -> Recipient.builder()
            .userId(rs.getString("id"))
            .email(rs.getString("email"))
            .name(rs.getString("name"))
            .companyId(rs.getString("company_id"))
            .build();

    @Override
    public Optional<String> findUserRole(String userId) {
        List<String> roles = jdbcTemplate.queryForList("SELECT role FROM users WHERE id = ?", String.class, userId);
        return roles.stream().filter(Objects::nonNull).findFirst();
    }

    @Override
    public List<Recipient> findActiveUsers(String companyId) {
        StringBuilder sql = new StringBuilder(
                "SELECT id, email, name, company_id FROM users WHERE status = ? AND (role IS NULL OR role <> ?)");
        List<Object> args = new ArrayList<>(List.of(Constants.PrincipalStatus.USER_ACTIVE, Constants.SUPER_ADMIN_ROLE));
        if (companyId != null) {
            sql.append(" AND company_id = ?");
            args.add(companyId);
        }
        return jdbcTemplate.query(sql.toString(), recipientMapper, args.toArray());
    }

    @Override
    public List<Recipient> findActiveCompanyAdmins(String companyId) {
        StringBuilder sql = new StringBuilder("SELECT id, email, name, company_id FROM company_admins WHERE status = ?");
        List<Object> args = new ArrayList<>(List.of(Constants.PrincipalStatus.COMPANY_ADMIN_ACTIVE));
        if (companyId != null) {
            sql.append(" AND company_id = ?");
            args.add(companyId);
        }
        return jdbcTemplate.query(sql.toString(), recipientMapper, args.toArray());
    }
}
