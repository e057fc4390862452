package com.tfbuilder.tfbuilder_backend.terraform.reference;

/** Resource type and label, e.g. ("aws_vpc", "main_vpc"). */
public record ResourceAddress(String type, String name) {}
