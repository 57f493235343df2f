package quest.gekko.pulse.domain;

public enum CentroidScope { USER, GLOBAL }
