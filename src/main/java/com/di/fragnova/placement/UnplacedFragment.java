package com.di.fragnova.placement;

public record UnplacedFragment(String fragmentId, UnplacedReason reason) {
}
