package com.dbmaster.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialMigrationResponse {
    private int migrated;
    private int skipped;
    private int failed;
}
