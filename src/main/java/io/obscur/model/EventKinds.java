package io.obscur.model;

public final class EventKinds {
    public static final int CONTACT_LIST = 3;
    public static final int ENCRYPTED_DM = 4;
    public static final int SEAL = 13;
    public static final int CHAT_MESSAGE = 14;
    public static final int GIFT_WRAP = 1059;

    private EventKinds() {
    }
}
