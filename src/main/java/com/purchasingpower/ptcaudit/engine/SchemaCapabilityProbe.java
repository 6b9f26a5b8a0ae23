package com.purchasingpower.ptcaudit.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives {@link SchemaCapabilities} from the column names present on the
 * tool-call record set.
 */
@Slf4j
@Component
public class SchemaCapabilityProbe {

    public static final String TYPE_COLUMN = "type";
    public static final String PARENT_REF_COLUMN = "ptc_call_id";

    /**
     * @param toolCallColumns column names of {@code tool_call_results}; may be
     *                        restricted to the optional ones
     * @return capability flags; missing columns simply yield false
     */
    public SchemaCapabilities probe(Collection<String> toolCallColumns) {
        Set<String> columns = toolCallColumns.stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        SchemaCapabilities capabilities = new SchemaCapabilities(
                columns.contains(TYPE_COLUMN),
                columns.contains(PARENT_REF_COLUMN));

        if (!capabilities.isComplete()) {
            log.info("Tool-call schema predates pass-through columns (type={}, ptc_call_id={}); using fallbacks",
                    capabilities.hasTypeTag(), capabilities.hasParentRef());
        }
        return capabilities;
    }
}
