package com.dbmaster.model;

public record CommentChange(String oldComment, String newComment) {
}
