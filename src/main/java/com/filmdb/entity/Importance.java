package com.filmdb.entity;

public enum Importance {
	LEAD,
	SUPPORTING,
	CAMEO
}
