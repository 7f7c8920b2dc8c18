package org.drift.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of a schema node: kind, name, flat metadata map and children.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeDocument {

    static final String TYPE = "type";
    static final String FULL_TYPE = "fullType";
    static final String CONSTRAINTS = "constraints";
    static final String DEFINITION = "definition";
    static final String REFERENCED_TABLE = "referenced_table";
    static final String ORIGINAL_SQL = "original_sql";
    static final String TABLE = "table";
    static final String IS_UNIQUE = "is_unique";
    static final String COLUMNS = "columns";

    @JsonProperty("type")
    private String type;

    @JsonProperty("name")
    private String name;

    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonProperty("children")
    private List<NodeDocument> children = new ArrayList<>();
}
