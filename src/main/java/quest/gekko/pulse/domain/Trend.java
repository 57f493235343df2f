package quest.gekko.pulse.domain;

public enum Trend { NEW, UP, DOWN, STEADY }
