package com.purchasingpower.appcommit.service.impl;

import com.google.common.base.Utf8;
import com.purchasingpower.appcommit.exception.ContentException;
import com.purchasingpower.appcommit.model.commit.ResolvedContent;
import com.purchasingpower.appcommit.model.git.LoadedObject;
import com.purchasingpower.appcommit.model.git.ObjectKind;
import com.purchasingpower.appcommit.model.git.PathChange;
import com.purchasingpower.appcommit.repository.LocalGitRepository;
import com.purchasingpower.appcommit.service.ContentResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContentResolverImpl implements ContentResolver {

    private final LocalGitRepository localGitRepository;

    @Override
    public ResolvedContent resolve(PathChange change) {
        String path = change.path();
        String contentId = change.contentId();
        if (contentId == null || contentId.isBlank()) {
            throw new ContentException(path, "No staged content id for " + path);
        }

        LoadedObject object = localGitRepository.readObject(contentId)
                .orElseThrow(() -> new ContentException(path,
                        "Object " + contentId + " for " + path + " not found in the local repository"));
        if (object.kind() != ObjectKind.BLOB) {
            throw new ContentException(path,
                    "Object " + contentId + " for " + path + " is a " + object.kind() + ", not a blob");
        }

        byte[] bytes = object.bytes();
        if (Utf8.isWellFormed(bytes)) {
            return ResolvedContent.text(new String(bytes, StandardCharsets.UTF_8));
        }
        log.debug("{} is binary ({} bytes)", path, bytes.length);
        return ResolvedContent.binary(Base64.getEncoder().encodeToString(bytes));
    }
}
