package ru.aritmos.presencegateway.model;

import java.util.Set;

/**
 * Каталог типов событий, которые ходят по push-каналу.
 */
public final class PresenceEventKinds {

    private PresenceEventKinds() {
    }

    // Служебные типы протокола.
    public static final String AUTH = "auth";
    public static final String AUTH_ACK = "auth-ack";
    public static final String PING = "ping";
    public static final String PONG = "pong";

    // Начальные снимки и полные списки.
    public static final String APPOINTMENTS = "appointments";
    public static final String DOCTOR_DATA = "doctorData";
    public static final String EMERGENCY_TRANSPORTS = "emergencyTransports";
    public static final String EMERGENCY_TRANSPORTS_UPDATE = "emergencyTransportsUpdate";

    // Точечные изменения.
    public static final String DOCTOR_UPDATE = "doctorUpdate";
    public static final String DOCTOR_STATUS_UPDATED = "doctorStatusUpdated";
    public static final String APPOINTMENT_UPDATE = "appointmentUpdate";
    public static final String NEW_EMERGENCY_TRANSPORT = "newEmergencyTransport";

    public static final String DOCTOR_AVAILABILITY_CHANGED = "doctor-availability-changed";
    public static final String APPOINTMENT_UPDATED = "appointment-updated";
    public static final String EMERGENCY_TRANSPORT_UPDATED = "emergency-transport-updated";

    // Команды клиента после handshake.
    public static final String UPDATE_DOCTOR_STATUS = "updateDoctorStatus";
    public static final String UPDATE_APPOINTMENT = "updateAppointment";
    public static final String UPDATE_EMERGENCY_TRANSPORT = "updateEmergencyTransport";

    private static final Set<String> CONTROL = Set.of(AUTH, AUTH_ACK, PING, PONG);

    public static boolean isControl(String kind) {
        return kind != null && CONTROL.contains(kind);
    }
}
