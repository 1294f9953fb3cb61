package com.kickstack.realtime.relay.websocket;

import com.kickstack.realtime.common.constant.RelayConstants;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Query parameters of a connect request:
 * {@code ?table=orders,users&since=42}
 */
@Slf4j
@Value
public class ConnectParameters {

    /**
     * Requested tables, trimmed and de-duplicated, in request order
     */
    List<String> tables;

    /**
     * Resume point, null when absent or unparseable
     */
    Long since;

    public static ConnectParameters parse(URI uri) {
        if (uri == null) {
            return new ConnectParameters(List.of(), null);
        }

        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();

        Set<String> tables = new LinkedHashSet<>();
        List<String> tableParams = params.get(RelayConstants.PARAM_TABLE);
        if (tableParams != null) {
            for (String value : tableParams) {
                if (value == null) {
                    continue;
                }
                for (String table : decode(value).split(RelayConstants.TABLE_SEPARATOR)) {
                    if (!table.isBlank()) {
                        tables.add(table.trim());
                    }
                }
            }
        }

        return new ConnectParameters(new ArrayList<>(tables), parseSince(params.getFirst(RelayConstants.PARAM_SINCE)));
    }

    private static Long parseSince(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(decode(value).trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable since parameter '{}'", value);
            return null;
        }
    }

    private static String decode(String value) {
        return UriUtils.decode(value, StandardCharsets.UTF_8);
    }
}
