package com.deepansh.orchestrator.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "workflow_plans")
@CompoundIndex(name = "idx_plan_query_category", def = "{'query': 1, 'category': 1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredPlan {

    @Id
    private String id;

    private String query;
    private String category;
    private String plan;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
