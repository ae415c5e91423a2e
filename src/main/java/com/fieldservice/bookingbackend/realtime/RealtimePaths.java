package com.fieldservice.bookingbackend.realtime;

public final class RealtimePaths {

    private RealtimePaths() {
    }

    public static String current(String professionalId) {
        return "locations/" + professionalId + "/current";
    }

    public static String currentField(String professionalId, String field) {
        return current(professionalId) + "/" + field;
    }

    public static String historyStream(String professionalId) {
        return "locations/" + professionalId + "/history-stream";
    }

    public static String historyStreamEntry(String professionalId, String entryKey) {
        return historyStream(professionalId) + "/" + entryKey;
    }

    public static String subscribers(String professionalId) {
        return "locations/" + professionalId + "/subscribers";
    }

    public static String subscriber(String professionalId, String subscriberId) {
        return subscribers(professionalId) + "/" + subscriberId;
    }

    public static String subscriptions(String subscriberId) {
        return "users/" + subscriberId + "/subscriptions";
    }

    public static String subscription(String subscriberId, String professionalId) {
        return subscriptions(subscriberId) + "/" + professionalId;
    }

    public static String notification(String recipientId, long epochMillis) {
        return "notifications/" + recipientId + "/" + epochMillis;
    }

    static String parent(String path) {
        int idx = path.lastIndexOf('/');
        return idx > 0 ? path.substring(0, idx) : null;
    }

    static String lastSegment(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
