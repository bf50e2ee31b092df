package com.di.insightnova.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL queries loaded from sql-queries.yml (insightnova.sql.*).
 * No SQL is hardcoded in JDBC store classes; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "insightnova.sql")
public class SqlQueriesProperties {

    private Staging staging = new Staging();
    private Tasks tasks = new Tasks();
    private Scaling scaling = new Scaling();

    public Staging getStaging() { return staging; }
    public void setStaging(Staging staging) { this.staging = staging; }
    public Tasks getTasks() { return tasks; }
    public void setTasks(Tasks tasks) { this.tasks = tasks; }
    public Scaling getScaling() { return scaling; }
    public void setScaling(Scaling scaling) { this.scaling = scaling; }

    public static class Staging {
        private String insert;
        private String findById;
        private String findPendingBatch;
        private String markValid;
        private String markInvalid;
        private String markNeedsReview;
        private String saveEnrichment;
        private String saveEmbedding;
        private String countByStatus;
        private String countByStatusSince;
        private String deleteTerminalBefore;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindById() { return findById; }
        public void setFindById(String findById) { this.findById = findById; }
        public String getFindPendingBatch() { return findPendingBatch; }
        public void setFindPendingBatch(String findPendingBatch) { this.findPendingBatch = findPendingBatch; }
        public String getMarkValid() { return markValid; }
        public void setMarkValid(String markValid) { this.markValid = markValid; }
        public String getMarkInvalid() { return markInvalid; }
        public void setMarkInvalid(String markInvalid) { this.markInvalid = markInvalid; }
        public String getMarkNeedsReview() { return markNeedsReview; }
        public void setMarkNeedsReview(String markNeedsReview) { this.markNeedsReview = markNeedsReview; }
        public String getSaveEnrichment() { return saveEnrichment; }
        public void setSaveEnrichment(String saveEnrichment) { this.saveEnrichment = saveEnrichment; }
        public String getSaveEmbedding() { return saveEmbedding; }
        public void setSaveEmbedding(String saveEmbedding) { this.saveEmbedding = saveEmbedding; }
        public String getCountByStatus() { return countByStatus; }
        public void setCountByStatus(String countByStatus) { this.countByStatus = countByStatus; }
        public String getCountByStatusSince() { return countByStatusSince; }
        public void setCountByStatusSince(String countByStatusSince) { this.countByStatusSince = countByStatusSince; }
        public String getDeleteTerminalBefore() { return deleteTerminalBefore; }
        public void setDeleteTerminalBefore(String deleteTerminalBefore) { this.deleteTerminalBefore = deleteTerminalBefore; }
    }

    public static class Tasks {
        private String insertIfAbsent;
        private String claim;
        private String complete;
        private String fail;
        private String abandon;
        private String find;
        private String findByItem;
        private String findClaimable;
        private String expire;
        private String countByStatus;
        private String averageCompletionSecondsSince;
        private String deleteByItem;
        public String getInsertIfAbsent() { return insertIfAbsent; }
        public void setInsertIfAbsent(String insertIfAbsent) { this.insertIfAbsent = insertIfAbsent; }
        public String getClaim() { return claim; }
        public void setClaim(String claim) { this.claim = claim; }
        public String getComplete() { return complete; }
        public void setComplete(String complete) { this.complete = complete; }
        public String getFail() { return fail; }
        public void setFail(String fail) { this.fail = fail; }
        public String getAbandon() { return abandon; }
        public void setAbandon(String abandon) { this.abandon = abandon; }
        public String getFind() { return find; }
        public void setFind(String find) { this.find = find; }
        public String getFindByItem() { return findByItem; }
        public void setFindByItem(String findByItem) { this.findByItem = findByItem; }
        public String getFindClaimable() { return findClaimable; }
        public void setFindClaimable(String findClaimable) { this.findClaimable = findClaimable; }
        public String getExpire() { return expire; }
        public void setExpire(String expire) { this.expire = expire; }
        public String getCountByStatus() { return countByStatus; }
        public void setCountByStatus(String countByStatus) { this.countByStatus = countByStatus; }
        public String getAverageCompletionSecondsSince() { return averageCompletionSecondsSince; }
        public void setAverageCompletionSecondsSince(String averageCompletionSecondsSince) { this.averageCompletionSecondsSince = averageCompletionSecondsSince; }
        public String getDeleteByItem() { return deleteByItem; }
        public void setDeleteByItem(String deleteByItem) { this.deleteByItem = deleteByItem; }
    }

    public static class Scaling {
        private String findAll;
        private String findByType;
        private String insert;
        private String compareAndSet;
        public String getFindAll() { return findAll; }
        public void setFindAll(String findAll) { this.findAll = findAll; }
        public String getFindByType() { return findByType; }
        public void setFindByType(String findByType) { this.findByType = findByType; }
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getCompareAndSet() { return compareAndSet; }
        public void setCompareAndSet(String compareAndSet) { this.compareAndSet = compareAndSet; }
    }
}
