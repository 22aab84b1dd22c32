package com.prudhvi.event_stream.event;

/**
 * Internal event kinds published by the platform services onto the bus.
 *
 * Producers speak in these terms; subscribers only ever see the coarser
 * {@link EventName} and the {@link ScopeType} each kind belongs to.
 */
public enum DomainEventType {

    SECRET_CREATE(ScopeType.SECRETS, EventName.SECRET_CREATED),
    SECRET_BULK_CREATE(ScopeType.SECRETS, EventName.SECRET_CREATED),
    SECRET_UPDATE(ScopeType.SECRETS, EventName.SECRET_UPDATED),
    SECRET_BULK_UPDATE(ScopeType.SECRETS, EventName.SECRET_UPDATED),
    SECRET_DELETE(ScopeType.SECRETS, EventName.SECRET_DELETED),
    SECRET_BULK_DELETE(ScopeType.SECRETS, EventName.SECRET_DELETED),
    SECRET_IMPORT_MUTATION(ScopeType.SECRETS, EventName.SECRET_IMPORT_MUTATION),
    CERTIFICATE_ISSUE(ScopeType.PKI, EventName.CERTIFICATE_ISSUED),
    CERTIFICATE_RENEW(ScopeType.PKI, EventName.CERTIFICATE_ISSUED),
    CERTIFICATE_REVOKE(ScopeType.PKI, EventName.CERTIFICATE_REVOKED);

    private final ScopeType scopeType;
    private final EventName eventName;

    DomainEventType(ScopeType scopeType, EventName eventName) {
        this.scopeType = scopeType;
        this.eventName = eventName;
    }

    public ScopeType scopeType() {
        return scopeType;
    }

    public EventName eventName() {
        return eventName;
    }
}
