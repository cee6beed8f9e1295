package com.ogt.buildings.queue;

public enum JobType {

    PROCESS_EXPORT("buildings.export.queue"),
    SEND_COMPLETION_EMAIL("buildings.notification.queue");

    private final String queueName;

    JobType(String queueName) {
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }

    // La routing key coincide con el nombre de la cola, como en el resto de exchanges de OGT
    public String getRoutingKey() {
        return queueName;
    }

    public String getDelayQueueName() {
        return queueName.replace(".queue", ".delay");
    }

    public String getDelayRoutingKey() {
        return getDelayQueueName();
    }
}
