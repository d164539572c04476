package com.example.access.user;

import com.example.access.common.util.StringSanitizer;
import com.example.access.user.model.AccessUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class InMemoryUserDirectory implements UserDirectory {

    private final ConcurrentHashMap<String, AccessUser> users = new ConcurrentHashMap<>();

    @Override
    @NonNull
    public AccessUser save(@NonNull AccessUser user) {
        if (!StringSanitizer.isValidUserId(user.id())) {
            throw new IllegalArgumentException("Invalid user id: '" + StringSanitizer.forLog(user.id()) + "'");
        }
        users.put(user.id(), user);
        log.debug("Saved user {} (admin={}, active={})", user.id(), user.admin(), user.active());
        return user;
    }

    @Override
    @NonNull
    public Optional<AccessUser> find(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public boolean isAdmin(String userId) {
        return find(userId)
                .filter(AccessUser::active)
                .map(AccessUser::admin)
                .orElse(false);
    }

    @Override
    @NonNull
    public List<AccessUser> all() {
        return users.values().stream()
                .sorted(Comparator.comparing(AccessUser::id))
                .toList();
    }
}
