package com.purchasingpower.appcommit.model.github;

/**
 * https://docs.github.com/en/rest/git/blobs#create-a-blob
 */
public record CreateBlobRequest(String content, BlobEncoding encoding) {
}
