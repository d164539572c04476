package com.example.access.user;

import com.example.access.user.model.AccessUser;
import org.springframework.lang.NonNull;

import java.util.List;
import java.util.Optional;

public interface UserDirectory {

    @NonNull
    AccessUser save(@NonNull AccessUser user);

    @NonNull
    Optional<AccessUser> find(String userId);

    /**
     * Active users only; unknown and inactive users are never admins.
     */
    boolean isAdmin(String userId);

    @NonNull
    List<AccessUser> all();
}
