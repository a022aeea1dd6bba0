package com.example.blockalert.service;

import java.util.List;

/**
 * Maps a plate fingerprint to the users who registered it.
 */
public interface PlateDirectory {

    /**
     * @return distinct owner ids, empty when nobody registered the fingerprint
     */
    List<String> resolveOwners(String plateHash);
}
