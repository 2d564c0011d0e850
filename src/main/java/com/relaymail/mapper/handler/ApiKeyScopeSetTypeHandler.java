package com.relaymail.mapper.handler;

import com.relaymail.domain.ApiKeyScope;
import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps the stored scope list to a typed set when a credential row is loaded.
 * Accepts both "smtp,imap" and JSON array ["smtp","imap"] column values; an unknown
 * scope name fails the load instead of being carried around as an unmatched string.
 */
public class ApiKeyScopeSetTypeHandler extends BaseTypeHandler<Set<ApiKeyScope>> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, Set<ApiKeyScope> parameter, JdbcType jdbcType)
            throws SQLException {
        ps.setString(i, format(parameter));
    }

    @Override
    public Set<ApiKeyScope> getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return parse(rs.getString(columnName));
    }

    @Override
    public Set<ApiKeyScope> getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return parse(rs.getString(columnIndex));
    }

    @Override
    public Set<ApiKeyScope> getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return parse(cs.getString(columnIndex));
    }

    public static Set<ApiKeyScope> parse(String stored) {
        Set<ApiKeyScope> scopes = EnumSet.noneOf(ApiKeyScope.class);
        if (stored == null) {
            return scopes;
        }
        String list = stored.trim();
        if (list.startsWith("[") && list.endsWith("]")) {
            list = list.substring(1, list.length() - 1);
        }
        for (String token : list.split(",")) {
            String value = token.trim().replace("\"", "");
            if (!value.isEmpty()) {
                scopes.add(ApiKeyScope.fromValue(value));
            }
        }
        return scopes;
    }

    public static String format(Set<ApiKeyScope> scopes) {
        return scopes.stream()
                .map(ApiKeyScope::getValue)
                .collect(Collectors.joining(","));
    }
}
