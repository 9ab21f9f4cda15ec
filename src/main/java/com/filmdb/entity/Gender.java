package com.filmdb.entity;

public enum Gender {
	M,
	F,
	OTHER
}
